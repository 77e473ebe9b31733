package com.omniva.dbnotifier.registry;

import com.omniva.dbnotifier.config.DbNotifierConfig;
import com.omniva.dbnotifier.engine.ExclusiveSectionProvider;
import com.omniva.dbnotifier.engine.crankshaft.ArtifactLifecycleManager;
import com.omniva.dbnotifier.engine.fault.SubscriptionValidationException;
import com.omniva.dbnotifier.synthesis.ArtifactNames;
import com.omniva.dbnotifier.synthesis.NotificationSynthesizer;
import com.omniva.dbnotifier.synthesis.SynthesizedArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Intercepts registry writes and keeps the generated artifacts in step with them.
 * <p>
 * A write moves a subscription through {@code Absent -> Active -> Active' -> Absent}. Each
 * {@code intercept*} call validates and finalizes the proposed row and returns the
 * {@link RegistryMutation} describing the artifact work; {@link #apply(RegistryMutation)} then
 * runs it under the per-table exclusive sections. Everything happens inside the caller's
 * transaction, so a failure anywhere leaves both the registry and the artifacts as they were.
 */
public class RegistryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RegistryCoordinator.class);

    private final DbNotifierConfig config;
    private final SubscriptionCanonicalizer canonicalizer;
    private final NotificationSynthesizer synthesizer;
    private final ArtifactLifecycleManager lifecycleManager;
    private final ExclusiveSectionProvider sectionProvider;
    private final SubscriptionStore store;

    public RegistryCoordinator(DbNotifierConfig config,
                               SubscriptionCanonicalizer canonicalizer,
                               NotificationSynthesizer synthesizer,
                               ArtifactLifecycleManager lifecycleManager,
                               ExclusiveSectionProvider sectionProvider,
                               SubscriptionStore store) {
        this.config = config;
        this.canonicalizer = canonicalizer;
        this.synthesizer = synthesizer;
        this.lifecycleManager = lifecycleManager;
        this.sectionProvider = sectionProvider;
        this.store = store;
    }

    // ========================================
    // INTERCEPTION
    // ========================================

    public RegistryMutation interceptInsert(Subscription proposed) {
        Subscription canonical = canonicalizer.canonicalize(proposed);
        SynthesizedArtifact artifact = synthesize(canonical);

        return new RegistryMutation(
                withGeneratedNames(canonical, artifact),
                List.of(new ArtifactOperation.Install(canonical.getTableName(), artifact)),
                sections(List.of(canonical.getTableName())));
    }

    public RegistryMutation interceptUpdate(Subscription existing, Subscription proposed) {
        Subscription canonical = canonicalizer.canonicalize(proposed);
        SynthesizedArtifact artifact = synthesize(canonical);

        return new RegistryMutation(
                withGeneratedNames(canonical, artifact),
                List.of(uninstall(existing), new ArtifactOperation.Install(canonical.getTableName(), artifact)),
                sections(List.of(existing.getTableName(), canonical.getTableName())));
    }

    public RegistryMutation interceptDelete(Subscription existing) {
        return new RegistryMutation(
                existing,
                List.of(uninstall(existing)),
                sections(List.of(existing.getTableName())));
    }

    // ========================================
    // APPLICATION
    // ========================================

    /**
     * Acquire the mutation's sections in ascending order, then run its artifact operations in order.
     *
     * @throws SubscriptionValidationException if a new artifact would take over another
     *                                         subscription's artifact through name truncation
     */
    public void apply(RegistryMutation mutation) {
        for (int sectionId : mutation.sectionIds()) {
            log.debug("Acquiring exclusive section {}", sectionId);
            sectionProvider.acquire(sectionId);
        }

        for (ArtifactOperation operation : mutation.operations()) {
            if (operation instanceof ArtifactOperation.Install install) {
                requireOwnArtifactName(mutation.row(), install);
                lifecycleManager.install(install.tableName(), install.artifact());
            } else if (operation instanceof ArtifactOperation.Uninstall uninstall) {
                lifecycleManager.uninstall(uninstall.tableName(), uninstall.handlerName(), uninstall.artifactName());
            }
        }
    }

    /**
     * Install an artifact that no registry row tracks. It is still created under the table's
     * exclusive section; removing it later is up to the caller.
     */
    public ArtifactNames installUntracked(String tableName,
                                          String channelName,
                                          String notifName,
                                          List<String> columns,
                                          Collection<String> events) {
        SynthesizedArtifact artifact = synthesizer.synthesize(tableName, channelName, notifName, columns, events);
        sectionProvider.acquire(sectionId(tableName));
        lifecycleManager.install(tableName, artifact);
        return artifact.names();
    }

    /**
     * Section id of a table: the hash of the table name plus the configured lock suffix
     */
    public int sectionId(String tableName) {
        return (tableName + config.getLockSuffix()).hashCode();
    }

    private List<Integer> sections(Collection<String> tableNames) {
        TreeSet<Integer> ordered = new TreeSet<>();
        for (String tableName : tableNames) {
            ordered.add(sectionId(tableName));
        }
        return new ArrayList<>(ordered);
    }

    private SynthesizedArtifact synthesize(Subscription canonical) {
        return synthesizer.synthesize(
                canonical.getTableName(),
                canonical.getChannelName(),
                canonical.getNotifName(),
                canonical.getColumns(),
                canonical.getEvents());
    }

    private static Subscription withGeneratedNames(Subscription canonical, SynthesizedArtifact artifact) {
        return canonical.toBuilder()
                .generatedHandlerName(artifact.handlerName())
                .generatedArtifactName(artifact.artifactName())
                .build();
    }

    private static ArtifactOperation.Uninstall uninstall(Subscription existing) {
        return new ArtifactOperation.Uninstall(
                existing.getTableName(),
                existing.getGeneratedHandlerName(),
                existing.getGeneratedArtifactName());
    }

    // Rows with an equal key share the artifact legitimately; the store rejects those as duplicates.
    // Triggers are scoped to their table, handlers share one namespace across tables.
    private void requireOwnArtifactName(Subscription row, ArtifactOperation.Install install) {
        SubscriptionKey key = SubscriptionKey.of(row);
        String artifactName = install.artifact().artifactName();
        String handlerName = install.artifact().handlerName();

        List<Subscription> sharing = new ArrayList<>();
        for (Subscription other : store.findByTable(install.tableName())) {
            if (artifactName.equals(other.getGeneratedArtifactName())) {
                sharing.add(other);
            }
        }
        sharing.addAll(store.findByHandlerName(handlerName));

        for (Subscription other : sharing) {
            if (Objects.equals(other.getId(), row.getId()) || SubscriptionKey.of(other).equals(key)) {
                continue;
            }
            throw new SubscriptionValidationException(String.format(
                    "Derived artifact %s (handler %s) collides with subscription %d on %s after truncation to %d bytes; "
                            + "shorten the channel, table or notification name",
                    artifactName, handlerName, other.getId(), other.getTableName(), config.getMaxIdentifierLength()));
        }
    }
}
