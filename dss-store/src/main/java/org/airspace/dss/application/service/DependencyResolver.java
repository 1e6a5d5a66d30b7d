package org.airspace.dss.application.service;

import org.airspace.dss.application.port.output.OperationalIntentRepository;
import org.airspace.dss.application.port.output.SubscriptionRepository;
import org.airspace.dss.domain.error.InvalidInputException;
import org.airspace.dss.domain.model.EntityKind;
import org.airspace.dss.domain.model.IdentificationServiceArea;
import org.airspace.dss.domain.model.OperationalIntent;
import org.airspace.dss.domain.model.SpatialEntity;
import org.airspace.dss.domain.model.Subscription;
import org.airspace.dss.domain.model.VolumeQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Dependency bookkeeping between Operational Intents and Subscriptions.
 *
 * Intents reference subscriptions weakly: nothing here deletes an intent or
 * clears its subscription_id. Cleanup policy belongs to the API layer, which
 * uses {@link #dependentsOfSubscription(UUID)} to decide whether a
 * subscription can go. Notification delivery is external too; this class only
 * bumps the notification index of subscriptions an intent or ISA change affects.
 */
public final class DependencyResolver {
    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private final OperationalIntentRepository intents;
    private final SubscriptionRepository subscriptions;

    public DependencyResolver(OperationalIntentRepository intents, SubscriptionRepository subscriptions) {
        this.intents = intents;
        this.subscriptions = subscriptions;
    }

    /**
     * @return ids of intents linked to the subscription; empty if none
     */
    public List<UUID> dependentsOfSubscription(UUID subscriptionId) {
        if (subscriptionId == null) {
            throw new InvalidInputException(EntityKind.SUBSCRIPTION, "Missing subscription id for dependency lookup");
        }
        return intents.findDependentIds(subscriptionId);
    }

    public int dependentCount(UUID subscriptionId) {
        return dependentsOfSubscription(subscriptionId).size();
    }

    /**
     * Find subscriptions whose cells and time window overlap the intent and
     * increment their notification indices.
     *
     * @return the affected subscriptions carrying their new notification index
     */
    public List<Subscription> notifySubscriptionsAffectedBy(OperationalIntent intent) {
        return notifyOverlapping(intent, EntityKind.OPERATIONAL_INTENT);
    }

    /**
     * ISA counterpart of {@link #notifySubscriptionsAffectedBy(OperationalIntent)}:
     * called by the API layer after an ISA is created, updated or deleted.
     */
    public List<Subscription> notifySubscriptionsAffectedBy(IdentificationServiceArea isa) {
        return notifyOverlapping(isa, EntityKind.ISA);
    }

    private List<Subscription> notifyOverlapping(SpatialEntity changed, EntityKind kind) {
        if (changed == null || changed.cells().isEmpty()) {
            throw new InvalidInputException(kind,
                kind.displayName() + " with cells is required to resolve affected subscriptions");
        }
        VolumeQuery query = VolumeQuery.ofCells(changed.cells())
            .withTimeWindow(changed.startsAt(), changed.endsAt());

        List<Subscription> affected = subscriptions.search(query);
        if (affected.isEmpty()) {
            return List.of();
        }

        List<UUID> ids = new ArrayList<>(affected.size());
        for (Subscription s : affected) {
            ids.add(s.id());
        }
        List<Integer> indices = subscriptions.incrementNotificationIndices(ids);

        List<Subscription> updated = new ArrayList<>(affected.size());
        for (int i = 0; i < affected.size(); i++) {
            updated.add(affected.get(i).withNotificationIndex(indices.get(i)));
        }
        log.info("{} {} affects {} subscription(s)", kind.displayName(), changed.id(), updated.size());
        return updated;
    }
}
