package io.helmttl.services;

import com.google.common.base.Strings;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.ServiceAccountBuilder;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.api.model.rbac.ClusterRole;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBinding;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBindingBuilder;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBuilder;
import io.fabric8.kubernetes.api.model.rbac.PolicyRule;
import io.fabric8.kubernetes.api.model.rbac.PolicyRuleBuilder;
import io.fabric8.kubernetes.api.model.rbac.Role;
import io.fabric8.kubernetes.api.model.rbac.RoleBinding;
import io.fabric8.kubernetes.api.model.rbac.RoleBindingBuilder;
import io.fabric8.kubernetes.api.model.rbac.RoleBuilder;
import io.fabric8.kubernetes.api.model.rbac.RoleRef;
import io.fabric8.kubernetes.api.model.rbac.RoleRefBuilder;
import io.fabric8.kubernetes.api.model.rbac.Subject;
import io.fabric8.kubernetes.api.model.rbac.SubjectBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.helmttl.exceptions.KubernetesOperationException;
import io.helmttl.exceptions.ValidationException;
import io.helmttl.models.Labels;
import io.helmttl.models.OrphanedResource;
import lombok.extern.slf4j.Slf4j;

import java.net.HttpURLConnection;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Service account and RBAC objects needed by the TTL CronJob.
 * <p>
 * Three layouts exist:
 * <ul>
 *     <li>same namespace: one Role (secrets, cronjobs) and its RoleBinding</li>
 *     <li>cross namespace: a Role for secrets in the release namespace, a Role for cronjobs in the CronJob
 *     namespace, each with its RoleBinding</li>
 *     <li>cross namespace with namespace deletion: the above plus a ClusterRole on namespaces and its binding</li>
 * </ul>
 * Nothing here is transactional: every object is created or updated on its own and the orphan sweep
 * reconciles what a partial failure leaves behind.
 */
@Slf4j
abstract public class RbacService {
    public static final String SERVICE_ACCOUNT = "ServiceAccount";
    public static final String ROLE = "Role";
    public static final String ROLE_BINDING = "RoleBinding";
    public static final String CLUSTER_ROLE = "ClusterRole";
    public static final String CLUSTER_ROLE_BINDING = "ClusterRoleBinding";

    private static final String RBAC_API_GROUP = "rbac.authorization.k8s.io";

    private static final PolicyRule SECRETS_RULE = new PolicyRuleBuilder()
        .withApiGroups("")
        .withResources("secrets")
        .withVerbs("get", "list", "delete")
        .build();

    private static final PolicyRule CRONJOBS_RULE = new PolicyRuleBuilder()
        .withApiGroups("batch")
        .withResources("cronjobs")
        .withVerbs("get", "delete")
        .build();

    private static final PolicyRule NAMESPACES_RULE = new PolicyRuleBuilder()
        .withApiGroups("")
        .withResources("namespaces")
        .withVerbs("get", "delete")
        .build();

    /**
     * Creates or updates the service account and the RBAC objects for the layout matching the namespaces.
     * Calling it again with the same arguments changes nothing.
     *
     * @throws ValidationException           if the namespace must be deleted from inside itself
     * @throws KubernetesOperationException  if an object can't be created or updated
     */
    public static void provision(KubernetesClient client, String releaseName, String releaseNamespace, String cronjobNamespace, String serviceAccountName, boolean deleteNamespace) {
        if (deleteNamespace && releaseNamespace.equals(cronjobNamespace)) {
            throw new ValidationException(
                ValidationException.Reason.NAMESPACE_CONFLICT,
                "cannot use --delete-namespace when CronJob namespace equals release namespace (" + releaseNamespace + ")"
            );
        }

        String name = ResourceNameService.resourceName(releaseName, releaseNamespace);
        Map<String, String> labels = Labels.of(releaseName, releaseNamespace, cronjobNamespace, deleteNamespace);

        ServiceAccount serviceAccount = new ServiceAccountBuilder()
            .withNewMetadata()
                .withName(serviceAccountName)
                .withNamespace(cronjobNamespace)
                .withLabels(labels)
            .endMetadata()
            .build();

        createOrUpdate(
            "service account",
            serviceAccount,
            sa -> client.serviceAccounts().inNamespace(cronjobNamespace).resource(sa),
            (existing, desired) -> {}
        );

        Subject subject = new SubjectBuilder()
            .withKind(SERVICE_ACCOUNT)
            .withName(serviceAccountName)
            .withNamespace(cronjobNamespace)
            .build();

        if (releaseNamespace.equals(cronjobNamespace)) {
            createRoleAndBinding(client, name, releaseNamespace, labels, subject, List.of(SECRETS_RULE, CRONJOBS_RULE), "");
            return;
        }

        createRoleAndBinding(client, name, releaseNamespace, labels, subject, List.of(SECRETS_RULE), " in release namespace");
        createRoleAndBinding(client, name, cronjobNamespace, labels, subject, List.of(CRONJOBS_RULE), " in CronJob namespace");

        if (deleteNamespace) {
            createOrUpdate(
                "cluster role",
                new ClusterRoleBuilder()
                    .withNewMetadata()
                        .withName(name)
                        .withLabels(labels)
                    .endMetadata()
                    .withRules(NAMESPACES_RULE)
                    .build(),
                role -> client.rbac().clusterRoles().resource(role),
                (existing, desired) -> existing.setRules(desired.getRules())
            );

            createOrUpdate(
                "cluster role binding",
                new ClusterRoleBindingBuilder()
                    .withNewMetadata()
                        .withName(name)
                        .withLabels(labels)
                    .endMetadata()
                    .withSubjects(subject)
                    .withRoleRef(roleRef(CLUSTER_ROLE, name))
                    .build(),
                binding -> client.rbac().clusterRoleBindings().resource(binding),
                (existing, desired) -> {
                    existing.setSubjects(desired.getSubjects());
                    existing.setRoleRef(desired.getRoleRef());
                }
            );
        }
    }

    /**
     * Deletes every object {@link #provision} may have created. Missing objects are skipped.
     * <p>
     * Only the service account named after the resource is deleted. One provisioned under a custom name is left
     * behind until {@link #findOrphans} sweeps it.
     *
     * @throws KubernetesOperationException on the first deletion failing for another reason
     */
    public static void teardown(KubernetesClient client, String releaseName, String releaseNamespace, String cronjobNamespace) {
        String name = ResourceNameService.resourceName(releaseName, releaseNamespace);

        delete(
            OrphanedResource.clusterScoped(CLUSTER_ROLE_BINDING, name),
            () -> client.rbac().clusterRoleBindings().withName(name).delete()
        );
        delete(
            OrphanedResource.clusterScoped(CLUSTER_ROLE, name),
            () -> client.rbac().clusterRoles().withName(name).delete()
        );

        deleteNamespaced(client, name, releaseNamespace);
        if (!cronjobNamespace.equals(releaseNamespace)) {
            deleteNamespaced(client, name, cronjobNamespace);
        }

        delete(
            OrphanedResource.of(SERVICE_ACCOUNT, name, cronjobNamespace),
            () -> client.serviceAccounts().inNamespace(cronjobNamespace).withName(name).delete()
        );
    }

    /**
     * Looks for managed objects whose CronJob no longer exists: cluster-scoped bindings and roles first, then
     * role bindings, roles and service accounts of each namespace. Unless {@code dryRun}, each orphan is deleted
     * as soon as it is found.
     *
     * @return every orphan seen, deleted or not
     */
    public static List<OrphanedResource> findOrphans(KubernetesClient client, List<String> namespaces, boolean allNamespaces, boolean dryRun) {
        List<OrphanedResource> orphans = new ArrayList<>();

        List<String> scanned = namespaces;
        if (allNamespaces) {
            scanned = list("namespaces", () -> client.namespaces().list().getItems())
                .stream()
                .map(namespace -> namespace.getMetadata().getName())
                .collect(Collectors.toList());
        }

        sweep(
            client,
            CLUSTER_ROLE_BINDING,
            list("cluster role bindings", () -> client.rbac().clusterRoleBindings().withLabel(Labels.MANAGED_BY, Labels.MANAGED_BY_VALUE).list().getItems()),
            binding -> client.rbac().clusterRoleBindings().withName(binding.getMetadata().getName()),
            dryRun,
            orphans
        );

        sweep(
            client,
            CLUSTER_ROLE,
            list("cluster roles", () -> client.rbac().clusterRoles().withLabel(Labels.MANAGED_BY, Labels.MANAGED_BY_VALUE).list().getItems()),
            role -> client.rbac().clusterRoles().withName(role.getMetadata().getName()),
            dryRun,
            orphans
        );

        for (String namespace : scanned) {
            sweep(
                client,
                ROLE_BINDING,
                list("role bindings in " + namespace, () -> client.rbac().roleBindings().inNamespace(namespace).withLabel(Labels.MANAGED_BY, Labels.MANAGED_BY_VALUE).list().getItems()),
                binding -> client.rbac().roleBindings().inNamespace(namespace).withName(binding.getMetadata().getName()),
                dryRun,
                orphans
            );

            sweep(
                client,
                ROLE,
                list("roles in " + namespace, () -> client.rbac().roles().inNamespace(namespace).withLabel(Labels.MANAGED_BY, Labels.MANAGED_BY_VALUE).list().getItems()),
                role -> client.rbac().roles().inNamespace(namespace).withName(role.getMetadata().getName()),
                dryRun,
                orphans
            );

            sweep(
                client,
                SERVICE_ACCOUNT,
                list("service accounts in " + namespace, () -> client.serviceAccounts().inNamespace(namespace).withLabel(Labels.MANAGED_BY, Labels.MANAGED_BY_VALUE).list().getItems()),
                sa -> client.serviceAccounts().inNamespace(namespace).withName(sa.getMetadata().getName()),
                dryRun,
                orphans
            );
        }

        return orphans;
    }

    /**
     * An object is orphaned when the CronJob named by its labels is gone. The CronJob namespace label falls back
     * to the release namespace. Objects whose CronJob can't be checked are never considered orphaned.
     */
    static boolean isOrphaned(KubernetesClient client, Map<String, String> labels) {
        if (labels == null || Strings.isNullOrEmpty(labels.get(Labels.RELEASE)) || Strings.isNullOrEmpty(labels.get(Labels.RELEASE_NAMESPACE))) {
            return false;
        }

        String releaseNamespace = labels.get(Labels.RELEASE_NAMESPACE);
        String cronjobNamespace = Strings.isNullOrEmpty(labels.get(Labels.CRONJOB_NAMESPACE)) ? releaseNamespace : labels.get(Labels.CRONJOB_NAMESPACE);

        String name;
        try {
            name = ResourceNameService.resourceName(labels.get(Labels.RELEASE), releaseNamespace);
        } catch (ValidationException e) {
            log.debug("Ignoring labels {}: {}", labels, e.getMessage());
            return false;
        }

        try {
            return client.batch().v1().cronjobs().inNamespace(cronjobNamespace).withName(name).get() == null;
        } catch (KubernetesClientException e) {
            log.warn("Unable to check CronJob '{}' in namespace '{}', keeping its resources", name, cronjobNamespace, e);
            return false;
        }
    }

    private static void createRoleAndBinding(KubernetesClient client, String name, String namespace, Map<String, String> labels, Subject subject, List<PolicyRule> rules, String where) {
        createOrUpdate(
            "role" + where,
            new RoleBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                    .withLabels(labels)
                .endMetadata()
                .withRules(rules)
                .build(),
            role -> client.rbac().roles().inNamespace(namespace).resource(role),
            (existing, desired) -> existing.setRules(desired.getRules())
        );

        createOrUpdate(
            "role binding" + where,
            new RoleBindingBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                    .withLabels(labels)
                .endMetadata()
                .withSubjects(subject)
                .withRoleRef(roleRef(ROLE, name))
                .build(),
            binding -> client.rbac().roleBindings().inNamespace(namespace).resource(binding),
            (existing, desired) -> {
                existing.setSubjects(desired.getSubjects());
                existing.setRoleRef(desired.getRoleRef());
            }
        );
    }

    private static RoleRef roleRef(String kind, String name) {
        return new RoleRefBuilder()
            .withApiGroup(RBAC_API_GROUP)
            .withKind(kind)
            .withName(name)
            .build();
    }

    /**
     * Creates {@code desired}; if it already exists, overwrites the labels and whatever {@code overwrite} copies
     * on the live object, keeping every other field as the cluster has it.
     */
    private static <T extends HasMetadata> void createOrUpdate(String what, T desired, Function<T, Resource<T>> ref, BiConsumer<T, T> overwrite) {
        try {
            try {
                ref.apply(desired).create();
                log.info("{} '{}' is created", capitalize(what), desired.getMetadata().getName());
                return;
            } catch (KubernetesClientException e) {
                if (e.getCode() != HttpURLConnection.HTTP_CONFLICT) {
                    throw e;
                }
            }

            T existing = ref.apply(desired).get();
            if (existing == null) {
                ref.apply(desired).create();
                log.info("{} '{}' is created", capitalize(what), desired.getMetadata().getName());
                return;
            }

            existing.getMetadata().setLabels(new HashMap<>(desired.getMetadata().getLabels()));
            overwrite.accept(existing, desired);
            ref.apply(existing).update();
            log.info("{} '{}' is updated", capitalize(what), desired.getMetadata().getName());
        } catch (KubernetesClientException e) {
            throw new KubernetesOperationException("failed to create " + what, e);
        }
    }

    private static void deleteNamespaced(KubernetesClient client, String name, String namespace) {
        delete(
            OrphanedResource.of(ROLE_BINDING, name, namespace),
            () -> client.rbac().roleBindings().inNamespace(namespace).withName(name).delete()
        );
        delete(
            OrphanedResource.of(ROLE, name, namespace),
            () -> client.rbac().roles().inNamespace(namespace).withName(name).delete()
        );
    }

    private static void delete(OrphanedResource resource, Supplier<List<StatusDetails>> call) {
        try {
            if (call.get().isEmpty()) {
                log.debug("{} not found, nothing to delete", resource);
            } else {
                log.info("{} is deleted", resource);
            }
        } catch (KubernetesClientException e) {
            if (e.getCode() == HttpURLConnection.HTTP_NOT_FOUND) {
                log.debug("{} not found, nothing to delete", resource);
                return;
            }

            throw new KubernetesOperationException("failed to delete " + resource, e);
        }
    }

    private static <T extends HasMetadata> void sweep(KubernetesClient client, String kind, List<T> items, Function<T, Resource<T>> ref, boolean dryRun, List<OrphanedResource> orphans) {
        for (T item : items) {
            if (!isOrphaned(client, item.getMetadata().getLabels())) {
                continue;
            }

            OrphanedResource orphan = item.getMetadata().getNamespace() == null ?
                OrphanedResource.clusterScoped(kind, item.getMetadata().getName()) :
                OrphanedResource.of(kind, item.getMetadata().getName(), item.getMetadata().getNamespace());

            orphans.add(orphan);

            if (dryRun) {
                log.info("Would delete {}", orphan);
            } else {
                delete(orphan, () -> ref.apply(item).delete());
            }
        }
    }

    private static <T> List<T> list(String what, Supplier<List<T>> call) {
        try {
            return call.get();
        } catch (KubernetesClientException e) {
            throw new KubernetesOperationException("failed to list " + what, e);
        }
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
