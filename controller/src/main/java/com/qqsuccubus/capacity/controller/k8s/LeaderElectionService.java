package com.qqsuccubus.capacity.controller.k8s;

import io.fabric8.kubernetes.api.model.coordination.v1.Lease;
import io.fabric8.kubernetes.api.model.coordination.v1.LeaseBuilder;
import io.fabric8.kubernetes.api.model.coordination.v1.LeaseSpec;
import io.fabric8.kubernetes.api.model.coordination.v1.LeaseSpecBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Kubernetes Lease based leader election between controller replicas.
 * <p>
 * Only the lease holder runs decision cycles; the other replicas keep collecting nothing and retry the
 * lease every renewal interval. A lease not renewed within its duration is taken over.
 * </p>
 */
public class LeaderElectionService {
    private static final Logger log = LoggerFactory.getLogger(LeaderElectionService.class);

    static final String LEASE_NAME = "capacity-controller-leader";
    static final int LEASE_DURATION_SECONDS = 15;
    static final Duration RENEW_INTERVAL = Duration.ofSeconds(10);

    private final KubernetesClient client;
    private final String namespace;
    private final String identity;
    private final AtomicBoolean leader = new AtomicBoolean(false);
    private Disposable renewal;

    public LeaderElectionService(String namespace, String identity) {
        this.client = new KubernetesClientBuilder().build();
        this.namespace = namespace;
        this.identity = identity;
        log.info("Leader election initialized for {} in namespace {}", identity, namespace);
    }

    /**
     * Tries to take the lease right away, then keeps renewing or competing for it.
     */
    public Disposable start() {
        renewal = Flux.interval(Duration.ZERO, RENEW_INTERVAL)
            .onBackpressureDrop()
            .concatMap(tick -> tryAcquireOrRenew(), 1)
            .subscribe();
        return renewal;
    }

    public boolean isLeader() {
        return leader.get();
    }

    /**
     * Stops competing and deletes the lease if held, so another replica takes over without waiting for expiry.
     */
    public void stop() {
        if (renewal != null) {
            renewal.dispose();
        }
        if (leader.getAndSet(false)) {
            try {
                client.leases().inNamespace(namespace).withName(LEASE_NAME).delete();
                log.info("Lease released by {}", identity);
            } catch (Exception e) {
                log.warn("Failed to release lease during shutdown: {}", e.getMessage());
            }
        }
        client.close();
        log.info("Leader election stopped");
    }

    private Mono<Void> tryAcquireOrRenew() {
        return Mono.fromRunnable(() -> {
                Lease lease = client.leases().inNamespace(namespace).withName(LEASE_NAME).get();
                if (lease == null) {
                    create();
                } else {
                    acquireOrRenew(lease);
                }
            })
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(err -> {
                log.error("Leader election attempt failed: {}", err.getMessage());
                demote("lease unreachable");
                return Mono.empty();
            })
            .then();
    }

    private void create() {
        ZonedDateTime now = ZonedDateTime.now(ZoneOffset.UTC);
        Lease lease = new LeaseBuilder()
            .withNewMetadata()
            .withName(LEASE_NAME)
            .withNamespace(namespace)
            .endMetadata()
            .withSpec(spec(now, now))
            .build();
        try {
            client.leases().inNamespace(namespace).resource(lease).create();
            promote();
        } catch (Exception e) {
            log.warn("Lease creation lost to another replica: {}", e.getMessage());
            demote("lease created elsewhere");
        }
    }

    private void acquireOrRenew(Lease lease) {
        LeaseSpec current = lease.getSpec();
        String holder = current.getHolderIdentity();
        Instant renewedAt = current.getRenewTime() != null ? current.getRenewTime().toInstant() : Instant.EPOCH;
        int duration = current.getLeaseDurationSeconds() != null
            ? current.getLeaseDurationSeconds()
            : LEASE_DURATION_SECONDS;
        boolean expired = Duration.between(renewedAt, Instant.now()).getSeconds() > duration;

        if (!identity.equals(holder) && !expired) {
            demote("held by " + holder);
            return;
        }

        ZonedDateTime now = ZonedDateTime.now(ZoneOffset.UTC);
        ZonedDateTime acquiredAt = identity.equals(holder) && current.getAcquireTime() != null
            ? current.getAcquireTime()
            : now;
        if (!identity.equals(holder)) {
            log.info("Lease held by {} expired, taking over", holder);
        }
        lease.setSpec(spec(acquiredAt, now));
        try {
            // update() carries the resourceVersion, so a concurrent takeover fails with a conflict
            client.leases().inNamespace(namespace).resource(lease).update();
            promote();
        } catch (Exception e) {
            log.warn("Lease update rejected: {}", e.getMessage());
            demote("update rejected");
        }
    }

    private LeaseSpec spec(ZonedDateTime acquiredAt, ZonedDateTime renewedAt) {
        return new LeaseSpecBuilder()
            .withHolderIdentity(identity)
            .withLeaseDurationSeconds(LEASE_DURATION_SECONDS)
            .withAcquireTime(acquiredAt)
            .withRenewTime(renewedAt)
            .build();
    }

    private void promote() {
        if (!leader.getAndSet(true)) {
            log.info("Leadership acquired by {}", identity);
        }
    }

    private void demote(String reason) {
        if (leader.getAndSet(false)) {
            log.warn("Leadership lost by {}: {}", identity, reason);
        }
    }
}
