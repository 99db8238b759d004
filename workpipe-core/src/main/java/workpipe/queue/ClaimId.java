package workpipe.queue;

import java.util.Objects;
import java.util.UUID;

/**
 * Backend-specific tag identifying how a claim is tracked.
 *
 * <ul>
 *   <li>{@link Row}: a claim row addressed by surrogate key.
 *   <li>{@link PendingClaim}: a pending-claim record keyed by work type, item and version.
 *       Its token is unique per claim, so a handle outlived by its claim cannot resolve a
 *       later claim on the same item.
 *   <li>{@link DeliveryTag}: a broker delivery tag awaiting ack or nack.
 *   <li>{@link None}: the backend needs no claim bookkeeping.
 * </ul>
 */
public sealed interface ClaimId {

    /** Shared {@link None} instance. */
    ClaimId NONE = new None();

    record Row(long id) implements ClaimId {
    }

    record PendingClaim(String workType, String itemKey, int version, String owner, String token)
            implements ClaimId {
        public PendingClaim {
            Objects.requireNonNull(workType, "workType");
            Objects.requireNonNull(itemKey, "itemKey");
            Objects.requireNonNull(owner, "owner");
            Objects.requireNonNull(token, "token");
        }

        /** Returns a token for a new claim. */
        public static String newToken() {
            return UUID.randomUUID().toString();
        }
    }

    record DeliveryTag(long tag) implements ClaimId {
    }

    record None() implements ClaimId {
    }
}
