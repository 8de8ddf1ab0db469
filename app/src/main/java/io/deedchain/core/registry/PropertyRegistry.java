package io.deedchain.core.registry;

import io.deedchain.core.model.AccessGrant;
import io.deedchain.core.model.DocumentRecord;
import io.deedchain.core.model.PropertyDetails;
import io.deedchain.core.model.PropertyInfo;
import io.deedchain.core.model.PropertyMetadata;
import io.deedchain.core.model.PropertyStatus;
import io.deedchain.core.model.StatusChange;
import io.deedchain.core.model.SystemStatistics;
import io.deedchain.core.model.TransferRecord;
import io.deedchain.core.model.VerificationRecord;
import io.deedchain.core.protocol.FieldLimits;
import io.deedchain.core.state.Columns;
import io.deedchain.core.state.CounterKey;
import io.deedchain.core.state.GrantKey;
import io.deedchain.core.state.MembershipKey;
import io.deedchain.core.state.RegistryStore;
import io.deedchain.core.state.SequenceKey;
import io.deedchain.core.state.StateDelta;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.logging.Logger;

/**
 * The deed registry state machine.
 *
 * <p>Every mutating operation runs against a {@link StateDelta} over the store and checks,
 * in order, existence, authorization, input shape and business rules. The first failed
 * check aborts the operation and the delta is dropped; otherwise the whole write set is
 * committed as one batch. Operations are serialized on this instance.
 *
 * <p>Reads never write. Missing entities are reported as errors, except the ownership and
 * membership predicates, which answer {@code false}.
 */
public final class PropertyRegistry {
    private static final Logger LOG = Logger.getLogger(PropertyRegistry.class.getName());

    private final RegistryStore store;
    private final RegistryConfig config;

    public PropertyRegistry(RegistryStore store, RegistryConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = config != null ? config : RegistryConfig.defaults();
    }

    public PropertyRegistry(RegistryStore store) {
        this(store, RegistryConfig.defaults());
    }

    public RegistryConfig config() {
        return config;
    }

    // ------------------------------------------------------------------
    // Property metadata
    // ------------------------------------------------------------------

    /** Register a new property; returns its id. Registration is open to any caller. */
    public Result<Long> register(CallContext ctx, PropertyDetails details, String initialOwner) {
        return execute("register", ctx, delta -> {
            validateDetails(details);
            requirePrincipal(initialOwner, RegistryError.INVALID_OWNER, "initial owner");

            long propertyId = SequenceGenerator.next(delta, CounterKey.PROPERTY_ID);
            delta.put(Columns.PROPERTIES, propertyId, PropertyMetadata.registered(details, ctx.height()));
            delta.put(Columns.OWNERS, propertyId, initialOwner);
            delta.put(Columns.MEMBERSHIP, new MembershipKey(initialOwner, propertyId), Boolean.TRUE);
            delta.put(Columns.VERIFICATIONS, propertyId, VerificationRecord.unverified());
            SequenceGenerator.next(delta, CounterKey.TOTAL_PROPERTIES);
            return propertyId;
        });
    }

    public Result<Boolean> updateMetadata(CallContext ctx, long propertyId, PropertyDetails details) {
        return execute("update-metadata", ctx, delta -> {
            PropertyMetadata current = loadProperty(delta, propertyId);
            requireOwner(delta, propertyId, ctx.caller());
            validateDetails(details);

            delta.put(Columns.PROPERTIES, propertyId, current.withDetails(details, ctx.height()));
            return Boolean.TRUE;
        });
    }

    public Result<PropertyInfo> getPropertyInfo(long propertyId) {
        return query(delta -> {
            PropertyMetadata metadata = loadProperty(delta, propertyId);
            String owner = currentOwner(delta, propertyId);
            VerificationRecord verification = delta.get(Columns.VERIFICATIONS, propertyId)
                    .orElse(VerificationRecord.unverified());
            return new PropertyInfo(propertyId, owner, metadata, verification);
        });
    }

    // ------------------------------------------------------------------
    // Ownership & transfers
    // ------------------------------------------------------------------

    /**
     * Move a property from the caller to {@code newOwner}. The amount is recorded only;
     * no value changes hands.
     */
    public Result<Boolean> transfer(CallContext ctx, long propertyId, String newOwner,
                                    String reason, OptionalLong amount) {
        return execute("transfer", ctx, delta -> {
            PropertyMetadata current = loadProperty(delta, propertyId);
            String owner = requireOwner(delta, propertyId, ctx.caller());
            requirePrincipal(newOwner, RegistryError.INVALID_OWNER, "new owner");
            requireFits(reason, FieldLimits.MAX_REASON, "reason");
            OptionalLong recorded = amount != null ? amount : OptionalLong.empty();
            if (recorded.isPresent() && recorded.getAsLong() < 0) {
                throw new RegistryException(RegistryError.INVALID_PROPERTY_DATA, "amount must be >= 0");
            }
            if (newOwner.equals(owner)) {
                throw new RegistryException(RegistryError.INVALID_OWNER, "cannot transfer to the current owner");
            }

            long seq = SequenceGenerator.next(delta, CounterKey.transferSeq(propertyId));
            delta.put(Columns.TRANSFERS, new SequenceKey(propertyId, seq),
                    new TransferRecord(owner, newOwner, ctx.height(), nullToEmpty(reason), recorded));
            delta.put(Columns.OWNERS, propertyId, newOwner);
            delta.put(Columns.MEMBERSHIP, new MembershipKey(owner, propertyId), Boolean.FALSE);
            delta.put(Columns.MEMBERSHIP, new MembershipKey(newOwner, propertyId), Boolean.TRUE);
            delta.put(Columns.PROPERTIES, propertyId, current.touchedAt(ctx.height()));
            SequenceGenerator.next(delta, CounterKey.TOTAL_TRANSFERS);
            return Boolean.TRUE;
        });
    }

    public Result<TransferRecord> getTransfer(long propertyId, long transferId) {
        return query(delta -> {
            loadProperty(delta, propertyId);
            return delta.get(Columns.TRANSFERS, new SequenceKey(propertyId, transferId))
                    .orElseThrow(() -> new RegistryException(RegistryError.TRANSFER_NOT_FOUND,
                            "transfer " + transferId + " of property " + propertyId));
        });
    }

    public Result<Long> getTransferCount(long propertyId) {
        return query(delta -> {
            loadProperty(delta, propertyId);
            return SequenceGenerator.current(delta, CounterKey.transferSeq(propertyId));
        });
    }

    public Result<String> getOwner(long propertyId) {
        return query(delta -> {
            loadProperty(delta, propertyId);
            return currentOwner(delta, propertyId);
        });
    }

    /** True iff {@code who} is the current owner; false for unknown properties. */
    public synchronized boolean ownsProperty(long propertyId, String who) {
        if (who == null) {
            return false;
        }
        return store.get(Columns.OWNERS, propertyId).map(who::equals).orElse(false);
    }

    /** Point lookup in the membership table; false when no entry was ever written. */
    public synchronized boolean getOwnerMembership(String owner, long propertyId) {
        if (owner == null) {
            return false;
        }
        return store.get(Columns.MEMBERSHIP, new MembershipKey(owner, propertyId)).orElse(false);
    }

    // ------------------------------------------------------------------
    // Verification
    // ------------------------------------------------------------------

    /** One-time attestation by the caller. */
    public Result<Boolean> verify(CallContext ctx, long propertyId, String notes) {
        return execute("verify", ctx, delta -> {
            PropertyMetadata current = loadProperty(delta, propertyId);
            requireFits(notes, FieldLimits.MAX_NOTES, "notes");
            VerificationRecord existing = delta.get(Columns.VERIFICATIONS, propertyId)
                    .orElse(VerificationRecord.unverified());
            if (existing.verified()) {
                throw new RegistryException(RegistryError.ALREADY_VERIFIED,
                        "property " + propertyId + " verified by " + existing.verifier());
            }

            delta.put(Columns.VERIFICATIONS, propertyId,
                    VerificationRecord.verifiedBy(ctx.caller(), ctx.height(), nullToEmpty(notes)));
            delta.put(Columns.PROPERTIES, propertyId, current.touchedAt(ctx.height()));
            SequenceGenerator.next(delta, CounterKey.TOTAL_VERIFIED);
            return Boolean.TRUE;
        });
    }

    public Result<VerificationRecord> getVerification(long propertyId) {
        return query(delta -> {
            loadProperty(delta, propertyId);
            return delta.get(Columns.VERIFICATIONS, propertyId).orElse(VerificationRecord.unverified());
        });
    }

    // ------------------------------------------------------------------
    // Documents
    // ------------------------------------------------------------------

    /** Attach an immutable document; returns its per-property id. */
    public Result<Long> addDocument(CallContext ctx, long propertyId, String title, String documentType,
                                    String hash, String description) {
        return execute("add-document", ctx, delta -> {
            PropertyMetadata current = loadProperty(delta, propertyId);
            requireOwner(delta, propertyId, ctx.caller());
            requireText(title, FieldLimits.MAX_DOCUMENT_TITLE, "document title");
            requireText(documentType, FieldLimits.MAX_DOCUMENT_TYPE, "document type");
            requireText(hash, FieldLimits.MAX_DOCUMENT_HASH, "document hash");
            requireFits(description, FieldLimits.MAX_DOCUMENT_DESCRIPTION, "document description");

            long documentId = SequenceGenerator.next(delta, CounterKey.documentSeq(propertyId));
            delta.put(Columns.DOCUMENTS, new SequenceKey(propertyId, documentId),
                    new DocumentRecord(title, documentType, hash, ctx.height(), ctx.caller(),
                            nullToEmpty(description)));
            delta.put(Columns.PROPERTIES, propertyId, current.touchedAt(ctx.height()));
            return documentId;
        });
    }

    public Result<DocumentRecord> getDocument(long propertyId, long documentId) {
        return query(delta -> {
            loadProperty(delta, propertyId);
            return delta.get(Columns.DOCUMENTS, new SequenceKey(propertyId, documentId))
                    .orElseThrow(() -> new RegistryException(RegistryError.DOCUMENT_NOT_FOUND,
                            "document " + documentId + " of property " + propertyId));
        });
    }

    public Result<Long> getDocumentCount(long propertyId) {
        return query(delta -> {
            loadProperty(delta, propertyId);
            return SequenceGenerator.current(delta, CounterKey.documentSeq(propertyId));
        });
    }

    // ------------------------------------------------------------------
    // Status lifecycle
    // ------------------------------------------------------------------

    /**
     * Move a property to {@code newStatus}. A null status stands for an unknown status code
     * and is rejected like a disallowed transition.
     */
    public Result<Boolean> changeStatus(CallContext ctx, long propertyId, PropertyStatus newStatus, String reason) {
        return execute("change-status", ctx, delta -> {
            PropertyMetadata current = loadProperty(delta, propertyId);
            if (config.statusChangeRequiresOwner) {
                requireOwner(delta, propertyId, ctx.caller());
            }
            requireFits(reason, FieldLimits.MAX_REASON, "reason");
            if (newStatus == null) {
                throw new RegistryException(RegistryError.INVALID_STATUS, "unknown status");
            }
            if (!current.status().canTransitionTo(newStatus)) {
                throw new RegistryException(RegistryError.INVALID_STATUS,
                        current.status() + " -> " + newStatus + " not allowed");
            }

            long seq = SequenceGenerator.next(delta, CounterKey.statusSeq(propertyId));
            delta.put(Columns.STATUS_HISTORY, new SequenceKey(propertyId, seq),
                    new StatusChange(current.status(), newStatus, ctx.height(), ctx.caller(), nullToEmpty(reason)));
            delta.put(Columns.PROPERTIES, propertyId, current.withStatus(newStatus, ctx.height()));
            return Boolean.TRUE;
        });
    }

    /** All status changes of a property, oldest first. */
    public Result<List<StatusChange>> getStatusHistory(long propertyId) {
        return query(delta -> {
            loadProperty(delta, propertyId);
            long count = SequenceGenerator.current(delta, CounterKey.statusSeq(propertyId));
            List<StatusChange> history = new ArrayList<>();
            for (long seq = 1; seq <= count; seq++) {
                delta.get(Columns.STATUS_HISTORY, new SequenceKey(propertyId, seq)).ifPresent(history::add);
            }
            return List.copyOf(history);
        });
    }

    public Result<StatusChange> getStatusChange(long propertyId, long changeId) {
        return query(delta -> {
            loadProperty(delta, propertyId);
            return delta.get(Columns.STATUS_HISTORY, new SequenceKey(propertyId, changeId))
                    .orElseThrow(() -> new RegistryException(RegistryError.STATUS_CHANGE_NOT_FOUND,
                            "status change " + changeId + " of property " + propertyId));
        });
    }

    // ------------------------------------------------------------------
    // Access control
    // ------------------------------------------------------------------

    /** Create or overwrite the accessor's grant; the new grant is active. */
    public Result<Boolean> grant(CallContext ctx, long propertyId, String accessor, long level, OptionalLong expiresAt) {
        return execute("grant-access", ctx, delta -> {
            loadProperty(delta, propertyId);
            requireOwner(delta, propertyId, ctx.caller());
            requirePrincipal(accessor, RegistryError.INVALID_PROPERTY_DATA, "accessor");
            if (level < FieldLimits.MIN_ACCESS_LEVEL || level > FieldLimits.MAX_ACCESS_LEVEL) {
                throw new RegistryException(RegistryError.INVALID_ACCESS_LEVEL, "level " + level);
            }

            delta.put(Columns.GRANTS, new GrantKey(propertyId, accessor),
                    new AccessGrant((int) level, ctx.caller(), ctx.height(),
                            expiresAt != null ? expiresAt : OptionalLong.empty(), true));
            return Boolean.TRUE;
        });
    }

    /** Deactivate a grant; the record stays. */
    public Result<Boolean> revoke(CallContext ctx, long propertyId, String accessor) {
        return execute("revoke-access", ctx, delta -> {
            loadProperty(delta, propertyId);
            requireOwner(delta, propertyId, ctx.caller());
            GrantKey key = new GrantKey(propertyId, accessor == null ? "" : accessor);
            AccessGrant existing = delta.get(Columns.GRANTS, key)
                    .orElseThrow(() -> new RegistryException(RegistryError.GRANT_NOT_FOUND,
                            "no grant for " + accessor + " on property " + propertyId));

            delta.put(Columns.GRANTS, key, existing.revoked());
            return Boolean.TRUE;
        });
    }

    public Result<AccessGrant> getAccessGrant(long propertyId, String accessor) {
        return query(delta -> {
            loadProperty(delta, propertyId);
            return delta.get(Columns.GRANTS, new GrantKey(propertyId, accessor == null ? "" : accessor))
                    .orElseThrow(() -> new RegistryException(RegistryError.GRANT_NOT_FOUND,
                            "no grant for " + accessor + " on property " + propertyId));
        });
    }

    /** Access predicate evaluated at the registry's current height. */
    public synchronized boolean checkAccess(long propertyId, String accessor, long requiredLevel) {
        return checkAccess(propertyId, accessor, requiredLevel, currentHeight());
    }

    /**
     * The owner always passes. Anyone else needs an active, unexpired grant whose level is
     * numerically at least {@code requiredLevel}.
     */
    public synchronized boolean checkAccess(long propertyId, String accessor, long requiredLevel, long atHeight) {
        if (accessor == null) {
            return false;
        }
        Optional<String> owner = store.get(Columns.OWNERS, propertyId);
        if (owner.isEmpty()) {
            return false;
        }
        if (owner.get().equals(accessor)) {
            return true;
        }
        Optional<AccessGrant> grant = store.get(Columns.GRANTS, new GrantKey(propertyId, accessor));
        if (grant.isEmpty() || !grant.get().active()) {
            return false;
        }
        if (config.enforceGrantExpiry && grant.get().expiredAt(atHeight)) {
            return false;
        }
        return grant.get().level() >= requiredLevel;
    }

    // ------------------------------------------------------------------
    // Counters
    // ------------------------------------------------------------------

    public synchronized long getPropertyCount() {
        return SequenceGenerator.current(store, CounterKey.TOTAL_PROPERTIES);
    }

    public synchronized SystemStatistics getSystemStatistics() {
        return new SystemStatistics(
                SequenceGenerator.current(store, CounterKey.TOTAL_PROPERTIES),
                SequenceGenerator.current(store, CounterKey.TOTAL_TRANSFERS),
                SequenceGenerator.current(store, CounterKey.TOTAL_VERIFIED),
                currentHeight()
        );
    }

    /** Highest height the registry has executed at (0 before the first call). */
    public synchronized long currentHeight() {
        return store.get(Columns.META, Columns.HEIGHT).orElse(0L);
    }

    /** Record that the environment moved to {@code height}. Lower heights are ignored. */
    public synchronized void advanceTo(long height) {
        StateDelta delta = new StateDelta(store);
        recordHeight(delta, height);
        if (!delta.writes().isEmpty()) {
            store.write(delta.writes());
        }
    }

    // ------------------------------------------------------------------
    // internals
    // ------------------------------------------------------------------

    @FunctionalInterface
    private interface Step<T> {
        T apply(StateDelta delta);
    }

    private synchronized <T> Result<T> execute(String operation, CallContext ctx, Step<T> step) {
        Objects.requireNonNull(ctx, "ctx");
        StateDelta delta = new StateDelta(store);
        T value;
        try {
            value = step.apply(delta);
        } catch (RegistryException e) {
            LOG.fine(() -> operation + " by " + ctx.caller() + " rejected: " + e.getMessage());
            return Result.error(e.error());
        }
        recordHeight(delta, ctx.height());
        store.write(delta.writes());
        return Result.ok(value);
    }

    private synchronized <T> Result<T> query(Step<T> step) {
        try {
            return Result.ok(step.apply(new StateDelta(store)));
        } catch (RegistryException e) {
            return Result.error(e.error());
        }
    }

    private static void recordHeight(StateDelta delta, long height) {
        long known = delta.get(Columns.META, Columns.HEIGHT).orElse(0L);
        if (height > known) {
            delta.put(Columns.META, Columns.HEIGHT, height);
        }
    }

    private static PropertyMetadata loadProperty(StateDelta delta, long propertyId) {
        return delta.get(Columns.PROPERTIES, propertyId)
                .orElseThrow(() -> new RegistryException(RegistryError.PROPERTY_NOT_FOUND,
                        "property " + propertyId));
    }

    private static String currentOwner(StateDelta delta, long propertyId) {
        return delta.get(Columns.OWNERS, propertyId)
                .orElseThrow(() -> new IllegalStateException("property " + propertyId + " has no owner"));
    }

    private static String requireOwner(StateDelta delta, long propertyId, String caller) {
        String owner = currentOwner(delta, propertyId);
        if (!owner.equals(caller)) {
            throw new RegistryException(RegistryError.UNAUTHORIZED,
                    caller + " does not own property " + propertyId);
        }
        return owner;
    }

    private static void validateDetails(PropertyDetails details) {
        if (details == null) {
            throw new RegistryException(RegistryError.INVALID_PROPERTY_DATA, "details required");
        }
        requireText(details.title(), FieldLimits.MAX_TITLE, "title");
        requireText(details.description(), FieldLimits.MAX_DESCRIPTION, "description");
        requireText(details.location(), FieldLimits.MAX_LOCATION, "location");
        requireText(details.category(), FieldLimits.MAX_CATEGORY, "category");
        requireText(details.areaUnit(), FieldLimits.MAX_AREA_UNIT, "area unit");
        if (details.totalArea() <= 0) {
            throw new RegistryException(RegistryError.INVALID_PROPERTY_DATA, "total area must be > 0");
        }
    }

    private static void requireText(String value, int max, String field) {
        if (!FieldLimits.present(value, max)) {
            throw new RegistryException(RegistryError.INVALID_PROPERTY_DATA,
                    field + " must be 1.." + max + " characters");
        }
    }

    private static void requireFits(String value, int max, String field) {
        if (!FieldLimits.fits(value, max)) {
            throw new RegistryException(RegistryError.INVALID_PROPERTY_DATA,
                    field + " longer than " + max + " characters");
        }
    }

    private static void requirePrincipal(String value, RegistryError error, String field) {
        if (value == null || value.isBlank() || value.length() > FieldLimits.MAX_PRINCIPAL) {
            throw new RegistryException(error, field + " must be a non-blank account id");
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
