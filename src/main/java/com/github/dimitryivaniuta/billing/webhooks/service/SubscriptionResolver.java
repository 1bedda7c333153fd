package com.github.dimitryivaniuta.billing.webhooks.service;

import com.github.dimitryivaniuta.billing.webhooks.domain.Subscription;
import com.github.dimitryivaniuta.billing.webhooks.repo.SubscriptionRepository;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.TapCharge;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Finds the subscription a verified charge pays for.
 *
 * <p>Lookup order: the {@code user_id}/{@code service_id} pair from the charge metadata, then the
 * {@code tap_charge_id} back-reference written when the charge was created. Only the authoritative charge is
 * consulted, never the notification body.</p>
 */
@Service
public class SubscriptionResolver {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionResolver.class);

    static final String USER_ID = "user_id";
    static final String SERVICE_ID = "service_id";

    private final SubscriptionRepository subscriptionRepository;

    public SubscriptionResolver(SubscriptionRepository subscriptionRepository) {
        this.subscriptionRepository = subscriptionRepository;
    }

    public Optional<Subscription> resolve(TapCharge charge) {
        String userId = charge.metadataValue(USER_ID);
        String serviceId = charge.metadataValue(SERVICE_ID);

        if (userId != null && serviceId != null) {
            Optional<Subscription> byMetadata = subscriptionRepository.findByUserIdAndServiceId(userId, serviceId);
            if (byMetadata.isPresent()) {
                return byMetadata;
            }
        }

        Optional<Subscription> byCharge = subscriptionRepository.findFirstByTapChargeId(charge.id());
        if (byCharge.isPresent() && userId != null && !userId.equals(byCharge.get().getUserId())) {
            log.warn("Charge {} references subscription {} of another user; ignoring", charge.id(), byCharge.get().getId());
            return Optional.empty();
        }
        return byCharge;
    }
}
