package io.helmttl.services;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.rbac.ClusterRole;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBinding;
import io.fabric8.kubernetes.api.model.rbac.PolicyRuleBuilder;
import io.fabric8.kubernetes.api.model.rbac.Role;
import io.fabric8.kubernetes.api.model.rbac.RoleBinding;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.helmttl.TestUtils;
import io.helmttl.exceptions.ValidationException;
import io.helmttl.models.CronJobOptions;
import io.helmttl.models.Labels;
import io.helmttl.models.OrphanedResource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

@EnableKubernetesMockClient(crud = true)
class RbacServiceTest {
    KubernetesClient client;

    @Test
    void provisionSameNamespace() {
        RbacService.provision(client, "myapp", "staging", "staging", "myapp-staging-ttl", false);

        assertThat(client.serviceAccounts().inNamespace("staging").withName("myapp-staging-ttl").get(), notNullValue());

        Role role = client.rbac().roles().inNamespace("staging").withName("myapp-staging-ttl").get();
        assertThat(role.getRules(), hasSize(2));
        assertThat(role.getRules().get(0).getResources(), contains("secrets"));
        assertThat(role.getRules().get(0).getVerbs(), contains("get", "list", "delete"));
        assertThat(role.getRules().get(1).getApiGroups(), contains("batch"));
        assertThat(role.getRules().get(1).getResources(), contains("cronjobs"));
        assertThat(role.getRules().get(1).getVerbs(), contains("get", "delete"));
        assertLabels(role, "myapp", "staging", "staging");

        RoleBinding binding = client.rbac().roleBindings().inNamespace("staging").withName("myapp-staging-ttl").get();
        assertThat(binding.getRoleRef().getApiGroup(), is("rbac.authorization.k8s.io"));
        assertThat(binding.getRoleRef().getKind(), is("Role"));
        assertThat(binding.getRoleRef().getName(), is("myapp-staging-ttl"));
        assertThat(binding.getSubjects(), hasSize(1));
        assertThat(binding.getSubjects().get(0).getKind(), is("ServiceAccount"));
        assertThat(binding.getSubjects().get(0).getName(), is("myapp-staging-ttl"));
        assertThat(binding.getSubjects().get(0).getNamespace(), is("staging"));

        assertThat(client.rbac().clusterRoles().withName("myapp-staging-ttl").get(), nullValue());
        assertThat(client.rbac().clusterRoleBindings().withName("myapp-staging-ttl").get(), nullValue());
    }

    @Test
    void provisionCrossNamespace() {
        RbacService.provision(client, "myapp", "staging", "ops", "custom-sa", false);

        assertThat(client.serviceAccounts().inNamespace("ops").withName("custom-sa").get(), notNullValue());
        assertThat(client.serviceAccounts().inNamespace("staging").withName("custom-sa").get(), nullValue());

        Role releaseRole = client.rbac().roles().inNamespace("staging").withName("myapp-staging-ttl").get();
        assertThat(releaseRole.getRules(), hasSize(1));
        assertThat(releaseRole.getRules().get(0).getResources(), contains("secrets"));
        assertLabels(releaseRole, "myapp", "staging", "ops");

        Role cronjobRole = client.rbac().roles().inNamespace("ops").withName("myapp-staging-ttl").get();
        assertThat(cronjobRole.getRules(), hasSize(1));
        assertThat(cronjobRole.getRules().get(0).getResources(), contains("cronjobs"));

        RoleBinding releaseBinding = client.rbac().roleBindings().inNamespace("staging").withName("myapp-staging-ttl").get();
        assertThat(releaseBinding.getSubjects().get(0).getName(), is("custom-sa"));
        assertThat(releaseBinding.getSubjects().get(0).getNamespace(), is("ops"));
        assertThat(client.rbac().roleBindings().inNamespace("ops").withName("myapp-staging-ttl").get(), notNullValue());

        assertThat(client.rbac().clusterRoles().withName("myapp-staging-ttl").get(), nullValue());
        assertThat(client.rbac().clusterRoleBindings().withName("myapp-staging-ttl").get(), nullValue());
    }

    @Test
    void provisionCrossNamespaceDeletingNamespace() {
        RbacService.provision(client, "myapp", "staging", "ops", "myapp-staging-ttl", true);

        ClusterRole clusterRole = client.rbac().clusterRoles().withName("myapp-staging-ttl").get();
        assertThat(clusterRole.getRules(), hasSize(1));
        assertThat(clusterRole.getRules().get(0).getResources(), contains("namespaces"));
        assertThat(clusterRole.getRules().get(0).getVerbs(), contains("get", "delete"));
        assertThat(clusterRole.getMetadata().getLabels(), hasEntry(Labels.DELETE_NAMESPACE, "true"));

        ClusterRoleBinding clusterBinding = client.rbac().clusterRoleBindings().withName("myapp-staging-ttl").get();
        assertThat(clusterBinding.getRoleRef().getKind(), is("ClusterRole"));
        assertThat(clusterBinding.getSubjects().get(0).getNamespace(), is("ops"));

        assertThat(client.rbac().roles().inNamespace("staging").withName("myapp-staging-ttl").get(), notNullValue());
        assertThat(client.rbac().roles().inNamespace("ops").withName("myapp-staging-ttl").get(), notNullValue());
    }

    @Test
    void provisionIsIdempotent() {
        RbacService.provision(client, "myapp", "staging", "ops", "myapp-staging-ttl", true);
        RbacService.provision(client, "myapp", "staging", "ops", "myapp-staging-ttl", true);

        assertThat(managed(client.serviceAccounts().inNamespace("ops").list().getItems()), hasSize(1));
        assertThat(managed(client.rbac().roles().inNamespace("staging").list().getItems()), hasSize(1));
        assertThat(managed(client.rbac().roles().inNamespace("ops").list().getItems()), hasSize(1));
        assertThat(managed(client.rbac().roleBindings().inNamespace("staging").list().getItems()), hasSize(1));
        assertThat(managed(client.rbac().roleBindings().inNamespace("ops").list().getItems()), hasSize(1));
        assertThat(managed(client.rbac().clusterRoles().list().getItems()), hasSize(1));
        assertThat(managed(client.rbac().clusterRoleBindings().list().getItems()), hasSize(1));

        assertThat(client.rbac().roles().inNamespace("staging").withName("myapp-staging-ttl").get().getRules().get(0).getResources(), contains("secrets"));
        assertThat(client.rbac().clusterRoles().withName("myapp-staging-ttl").get().getRules().get(0).getResources(), contains("namespaces"));
    }

    @Test
    void provisionOverwritesDrift() {
        RbacService.provision(client, "myapp", "staging", "staging", "myapp-staging-ttl", false);

        Role role = client.rbac().roles().inNamespace("staging").withName("myapp-staging-ttl").get();
        role.setRules(List.of(new PolicyRuleBuilder().withApiGroups("").withResources("pods").withVerbs("get").build()));
        role.getMetadata().setLabels(Map.of("team", "payments"));
        client.rbac().roles().inNamespace("staging").resource(role).update();

        RbacService.provision(client, "myapp", "staging", "staging", "myapp-staging-ttl", false);

        Role repaired = client.rbac().roles().inNamespace("staging").withName("myapp-staging-ttl").get();
        assertThat(repaired.getRules(), hasSize(2));
        assertThat(repaired.getRules().get(0).getResources(), contains("secrets"));
        assertLabels(repaired, "myapp", "staging", "staging");
        assertThat(repaired.getMetadata().getLabels(), not(hasKey("team")));
    }

    @Test
    void provisionNamespaceConflict() {
        ValidationException exception = assertThrows(
            ValidationException.class,
            () -> RbacService.provision(client, "myapp", "ops", "ops", "myapp-ops-ttl", true)
        );

        assertThat(exception.getReason(), is(ValidationException.Reason.NAMESPACE_CONFLICT));
        assertThat(client.serviceAccounts().inNamespace("ops").withName("myapp-ops-ttl").get(), nullValue());
    }

    @Test
    void teardownSameNamespace() {
        RbacService.provision(client, "myapp", "staging", "staging", "myapp-staging-ttl", false);

        RbacService.teardown(client, "myapp", "staging", "staging");

        assertThat(client.serviceAccounts().inNamespace("staging").withName("myapp-staging-ttl").get(), nullValue());
        assertThat(client.rbac().roles().inNamespace("staging").withName("myapp-staging-ttl").get(), nullValue());
        assertThat(client.rbac().roleBindings().inNamespace("staging").withName("myapp-staging-ttl").get(), nullValue());
    }

    @Test
    void teardownCrossNamespace() {
        RbacService.provision(client, "myapp", "staging", "ops", "myapp-staging-ttl", true);

        RbacService.teardown(client, "myapp", "staging", "ops");

        assertThat(client.serviceAccounts().inNamespace("ops").withName("myapp-staging-ttl").get(), nullValue());
        assertThat(client.rbac().roles().inNamespace("staging").withName("myapp-staging-ttl").get(), nullValue());
        assertThat(client.rbac().roleBindings().inNamespace("staging").withName("myapp-staging-ttl").get(), nullValue());
        assertThat(client.rbac().roles().inNamespace("ops").withName("myapp-staging-ttl").get(), nullValue());
        assertThat(client.rbac().roleBindings().inNamespace("ops").withName("myapp-staging-ttl").get(), nullValue());
        assertThat(client.rbac().clusterRoles().withName("myapp-staging-ttl").get(), nullValue());
        assertThat(client.rbac().clusterRoleBindings().withName("myapp-staging-ttl").get(), nullValue());
    }

    @Test
    void teardownKeepsCustomServiceAccount() {
        RbacService.provision(client, "myapp", "staging", "staging", "cleaner", false);

        RbacService.teardown(client, "myapp", "staging", "staging");

        assertThat(client.rbac().roles().inNamespace("staging").withName("myapp-staging-ttl").get(), nullValue());
        assertThat(client.serviceAccounts().inNamespace("staging").withName("cleaner").get(), notNullValue());

        List<OrphanedResource> orphans = RbacService.findOrphans(client, List.of("staging"), false, false);

        assertThat(orphans, contains(OrphanedResource.of("ServiceAccount", "cleaner", "staging")));
        assertThat(client.serviceAccounts().inNamespace("staging").withName("cleaner").get(), nullValue());
    }

    @Test
    void teardownNothing() {
        RbacService.teardown(client, "myapp", "staging", "ops");

        assertThat(client.rbac().roles().inNamespace("staging").list().getItems(), empty());
    }

    @Test
    void findOrphansDryRun() {
        provisionWithCronJob("kept", "staging", "ops");
        RbacService.provision(client, "gone", "staging", "ops", "gone-staging-ttl", true);

        List<OrphanedResource> orphans = RbacService.findOrphans(client, List.of("staging", "ops"), false, true);

        assertThat(orphans.stream().map(OrphanedResource::toString).collect(Collectors.toList()), contains(
            "ClusterRoleBinding gone-staging-ttl (cluster-scoped)",
            "ClusterRole gone-staging-ttl (cluster-scoped)",
            "RoleBinding gone-staging-ttl in namespace staging",
            "Role gone-staging-ttl in namespace staging",
            "RoleBinding gone-staging-ttl in namespace ops",
            "Role gone-staging-ttl in namespace ops",
            "ServiceAccount gone-staging-ttl in namespace ops"
        ));

        assertThat(client.rbac().clusterRoles().withName("gone-staging-ttl").get(), notNullValue());
        assertThat(client.rbac().roles().inNamespace("staging").withName("gone-staging-ttl").get(), notNullValue());
        assertThat(client.serviceAccounts().inNamespace("ops").withName("gone-staging-ttl").get(), notNullValue());
    }

    @Test
    void findOrphans() {
        provisionWithCronJob("kept", "staging", "ops");
        RbacService.provision(client, "gone", "staging", "ops", "gone-staging-ttl", true);

        List<OrphanedResource> orphans = RbacService.findOrphans(client, List.of("staging", "ops"), false, false);

        assertThat(orphans, hasSize(7));
        assertThat(orphans.stream().map(OrphanedResource::getName).distinct().collect(Collectors.toList()), contains("gone-staging-ttl"));

        assertThat(client.rbac().clusterRoleBindings().withName("gone-staging-ttl").get(), nullValue());
        assertThat(client.rbac().clusterRoles().withName("gone-staging-ttl").get(), nullValue());
        assertThat(client.rbac().roles().inNamespace("staging").withName("gone-staging-ttl").get(), nullValue());
        assertThat(client.rbac().roleBindings().inNamespace("ops").withName("gone-staging-ttl").get(), nullValue());
        assertThat(client.serviceAccounts().inNamespace("ops").withName("gone-staging-ttl").get(), nullValue());

        assertThat(client.rbac().clusterRoles().withName("kept-staging-ttl").get(), notNullValue());
        assertThat(client.rbac().roles().inNamespace("staging").withName("kept-staging-ttl").get(), notNullValue());
        assertThat(client.rbac().roleBindings().inNamespace("ops").withName("kept-staging-ttl").get(), notNullValue());
        assertThat(client.serviceAccounts().inNamespace("ops").withName("kept-staging-ttl").get(), notNullValue());

        assertThat(RbacService.findOrphans(client, List.of("staging", "ops"), false, false), empty());
    }

    @Test
    void findOrphansOnlyScansRequestedNamespaces() {
        RbacService.provision(client, "gone", "staging", "staging", "gone-staging-ttl", false);

        assertThat(RbacService.findOrphans(client, List.of("ops"), false, true), empty());
        assertThat(RbacService.findOrphans(client, List.of("staging"), false, true), hasSize(3));
    }

    @Test
    void findOrphansAllNamespaces() {
        TestUtils.namespace(client, "staging");
        TestUtils.namespace(client, "ops");
        RbacService.provision(client, "gone", "staging", "staging", "gone-staging-ttl", false);
        RbacService.provision(client, "other", "ops", "ops", "other-ops-ttl", false);

        List<OrphanedResource> orphans = RbacService.findOrphans(client, List.of(), true, true);

        assertThat(orphans, hasSize(6));
        assertThat(orphans.stream().map(OrphanedResource::getNamespace).distinct().collect(Collectors.toList()), containsInAnyOrder("staging", "ops"));
    }

    @Test
    void isOrphaned() {
        provisionWithCronJob("kept", "staging", "staging");

        assertThat(RbacService.isOrphaned(client, Labels.of("kept", "staging", "staging", false)), is(false));
        assertThat(RbacService.isOrphaned(client, Labels.of("kept", "staging", "ops", false)), is(true));
        assertThat(RbacService.isOrphaned(client, Labels.of("gone", "staging", "staging", false)), is(true));

        // objects labelled before the cronjob namespace was recorded
        assertThat(RbacService.isOrphaned(client, Map.of(Labels.RELEASE, "kept", Labels.RELEASE_NAMESPACE, "staging")), is(false));

        assertThat(RbacService.isOrphaned(client, null), is(false));
        assertThat(RbacService.isOrphaned(client, Map.of(Labels.MANAGED_BY, Labels.MANAGED_BY_VALUE)), is(false));
        assertThat(RbacService.isOrphaned(client, Map.of(Labels.RELEASE, "x".repeat(60), Labels.RELEASE_NAMESPACE, "staging")), is(false));
    }

    private void provisionWithCronJob(String releaseName, String releaseNamespace, String cronjobNamespace) {
        String name = ResourceNameService.resourceName(releaseName, releaseNamespace);
        boolean deleteNamespace = !releaseNamespace.equals(cronjobNamespace);

        RbacService.provision(client, releaseName, releaseNamespace, cronjobNamespace, name, deleteNamespace);
        client.batch().v1().cronjobs().inNamespace(cronjobNamespace).resource(CronJobService.buildCronJob(CronJobOptions.builder()
            .releaseName(releaseName)
            .releaseNamespace(releaseNamespace)
            .cronjobNamespace(cronjobNamespace)
            .schedule("30 14 15 6 *")
            .serviceAccount(name)
            .deleteNamespace(deleteNamespace)
            .build()
        )).create();
    }

    private static <T extends HasMetadata> List<T> managed(List<T> items) {
        return items.stream()
            .filter(item -> item.getMetadata().getLabels() != null)
            .filter(item -> Labels.MANAGED_BY_VALUE.equals(item.getMetadata().getLabels().get(Labels.MANAGED_BY)))
            .collect(Collectors.toList());
    }

    private static void assertLabels(HasMetadata object, String releaseName, String releaseNamespace, String cronjobNamespace) {
        assertThat(object.getMetadata().getLabels(), hasEntry(Labels.MANAGED_BY, Labels.MANAGED_BY_VALUE));
        assertThat(object.getMetadata().getLabels(), hasEntry(Labels.RELEASE, releaseName));
        assertThat(object.getMetadata().getLabels(), hasEntry(Labels.RELEASE_NAMESPACE, releaseNamespace));
        assertThat(object.getMetadata().getLabels(), hasEntry(Labels.CRONJOB_NAMESPACE, cronjobNamespace));
    }
}
