package com.qqsuccubus.capacity.controller.k8s;

import com.qqsuccubus.capacity.controller.executor.IScalingApi;
import com.qqsuccubus.capacity.core.error.ApplyFailedException;
import com.qqsuccubus.capacity.core.model.Target;
import com.qqsuccubus.capacity.core.model.WorkloadRef;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Scales a target's Deployment or StatefulSet through the scale subresource.
 * <p>
 * fabric8 calls block, so every call runs on the bounded-elastic scheduler.
 * </p>
 */
public class KubernetesScalingApi implements IScalingApi {
    private static final Logger log = LoggerFactory.getLogger(KubernetesScalingApi.class);

    static final String STATEFUL_SET = "StatefulSet";

    private final KubernetesClient client;
    private final String defaultNamespace;

    public KubernetesScalingApi(String defaultNamespace) {
        this(new KubernetesClientBuilder().build(), defaultNamespace);
    }

    public KubernetesScalingApi(KubernetesClient client, String defaultNamespace) {
        this.client = client;
        this.defaultNamespace = defaultNamespace;
        log.info("Kubernetes scaling API initialized: default namespace={}", defaultNamespace);
    }

    @Override
    public Mono<Void> setDesiredCapacity(Target target, int capacity) {
        return Mono.fromRunnable(() -> {
                WorkloadRef workload = workloadOf(target);
                String namespace = namespaceOf(workload);
                if (STATEFUL_SET.equals(workload.getKind())) {
                    StatefulSet existing = client.apps().statefulSets()
                        .inNamespace(namespace).withName(workload.getName()).get();
                    if (existing == null) {
                        throw notFound(target, workload, namespace);
                    }
                    client.apps().statefulSets().inNamespace(namespace).withName(workload.getName()).scale(capacity);
                } else {
                    Deployment existing = client.apps().deployments()
                        .inNamespace(namespace).withName(workload.getName()).get();
                    if (existing == null) {
                        throw notFound(target, workload, namespace);
                    }
                    client.apps().deployments().inNamespace(namespace).withName(workload.getName()).scale(capacity);
                }
                log.info("Scaled {} {}/{} to {} replicas", workload.getKind(), namespace, workload.getName(), capacity);
            })
            .subscribeOn(Schedulers.boundedElastic())
            .then();
    }

    @Override
    public Mono<Integer> currentCapacity(Target target) {
        return Mono.fromCallable(() -> {
                WorkloadRef workload = workloadOf(target);
                String namespace = namespaceOf(workload);
                Integer replicas;
                if (STATEFUL_SET.equals(workload.getKind())) {
                    StatefulSet statefulSet = client.apps().statefulSets()
                        .inNamespace(namespace).withName(workload.getName()).get();
                    if (statefulSet == null) {
                        throw notFound(target, workload, namespace);
                    }
                    replicas = statefulSet.getSpec().getReplicas();
                } else {
                    Deployment deployment = client.apps().deployments()
                        .inNamespace(namespace).withName(workload.getName()).get();
                    if (deployment == null) {
                        throw notFound(target, workload, namespace);
                    }
                    replicas = deployment.getSpec().getReplicas();
                }
                return replicas != null ? replicas : 0;
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public void close() {
        client.close();
        log.info("Kubernetes scaling API closed");
    }

    private WorkloadRef workloadOf(Target target) {
        WorkloadRef workload = target.getWorkload();
        if (workload == null || workload.getName() == null) {
            throw new ApplyFailedException(target.getId(), "Target has no workload reference");
        }
        return workload;
    }

    private String namespaceOf(WorkloadRef workload) {
        return workload.getNamespace() != null ? workload.getNamespace() : defaultNamespace;
    }

    private static ApplyFailedException notFound(Target target, WorkloadRef workload, String namespace) {
        return new ApplyFailedException(target.getId(),
            String.format("%s %s not found in namespace %s", workload.getKind(), workload.getName(), namespace));
    }
}
