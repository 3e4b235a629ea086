package org.alertingupgrade.migrations.service;

import java.nio.file.Path;
import java.time.Clock;

import org.alertingupgrade.migrations.datasources.JdbcDatasourceCache;
import org.alertingupgrade.migrations.folders.FolderService;
import org.alertingupgrade.migrations.folders.JdbcFolderService;
import org.alertingupgrade.migrations.folders.JdbcPermissionService;
import org.alertingupgrade.migrations.folders.PermissionService;
import org.alertingupgrade.migrations.ledger.MigrationLedgerStore;
import org.alertingupgrade.migrations.lock.JdbcServerLockService;
import org.alertingupgrade.migrations.lock.ServerLockService;
import org.alertingupgrade.migrations.notifier.ContactPointSynthesizer;
import org.alertingupgrade.migrations.notifier.IntegrationSettingsValidator;
import org.alertingupgrade.migrations.notifier.NotifierValidator;
import org.alertingupgrade.migrations.rules.AlertRuleSynthesizer;
import org.alertingupgrade.migrations.rules.ConditionTranslator;
import org.alertingupgrade.migrations.rules.QueryRewriter;
import org.alertingupgrade.migrations.secrets.EncryptionService;
import org.alertingupgrade.migrations.silences.SilenceFileWriter;
import org.alertingupgrade.migrations.silences.SilenceSink;
import org.alertingupgrade.migrations.silences.SilenceSynthesizer;
import org.alertingupgrade.migrations.store.DatabaseClient;
import org.alertingupgrade.migrations.store.JdbcKvStore;
import org.alertingupgrade.migrations.store.JdbcMigrationStore;
import org.alertingupgrade.migrations.store.MigrationStore;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Value;

/** The collaborators a {@link MigrationService} works with */
@Value
@Builder
public class MigrationComponents {
    MigrationStore store;
    MigrationLedgerStore ledgerStore;
    FolderService folderService;
    PermissionService permissionService;
    AlertRuleSynthesizer ruleSynthesizer;
    SilenceSynthesizer silenceSynthesizer;
    SilenceSink silenceSink;
    ContactPointSynthesizer contactPointSynthesizer;
    NotifierValidator notifierValidator;
    ServerLockService serverLockService;
    ObjectMapper mapper;

    /** Everything backed by one relational database, with silences written below {@code dataPath} */
    public static MigrationComponents jdbc(DatabaseClient dbClient,
                                           EncryptionService encryptionService,
                                           ObjectMapper mapper,
                                           Path dataPath,
                                           Clock clock) {
        var store = new JdbcMigrationStore(dbClient, mapper, clock);
        var conditionTranslator = new ConditionTranslator(new JdbcDatasourceCache(dbClient), mapper);
        return MigrationComponents.builder()
            .store(store)
            .ledgerStore(new MigrationLedgerStore(new JdbcKvStore(dbClient, clock), mapper))
            .folderService(new JdbcFolderService(dbClient, clock))
            .permissionService(new JdbcPermissionService(dbClient, clock))
            .ruleSynthesizer(new AlertRuleSynthesizer(conditionTranslator, new QueryRewriter(mapper), store, mapper,
                clock))
            .silenceSynthesizer(new SilenceSynthesizer(clock))
            .silenceSink(new SilenceFileWriter(dataPath))
            .contactPointSynthesizer(new ContactPointSynthesizer(encryptionService, mapper))
            .notifierValidator(new IntegrationSettingsValidator(encryptionService))
            .serverLockService(new JdbcServerLockService(dbClient, clock))
            .mapper(mapper)
            .build();
    }
}
