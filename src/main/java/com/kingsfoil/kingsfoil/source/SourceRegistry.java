package com.kingsfoil.kingsfoil.source;

import com.kingsfoil.kingsfoil.version.VersionRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authoritative lookup of data source configurations by source code.
 *
 * <p>Configurations are seeded from the classpath at startup, persisted in the configuration table
 * and cached in memory. Once any version references a source, only additive alias changes are accepted.
 */
@Service
public class SourceRegistry {

    private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

    private final SourceConfigRepository sourceConfigRepository;
    private final SourceConfigLoader sourceConfigLoader;
    private final SourceSchemaManager sourceSchemaManager;
    private final VersionRepository versionRepository;
    private final Map<String, DataSourceConfig> configs = new ConcurrentHashMap<>();

    public SourceRegistry(
            SourceConfigRepository sourceConfigRepository,
            SourceConfigLoader sourceConfigLoader,
            SourceSchemaManager sourceSchemaManager,
            VersionRepository versionRepository
    ) {
        this.sourceConfigRepository = sourceConfigRepository;
        this.sourceConfigLoader = sourceConfigLoader;
        this.sourceSchemaManager = sourceSchemaManager;
        this.versionRepository = versionRepository;
    }

    /**
     * Seeds classpath configurations, then prepares tables and the cache for everything persisted.
     */
    @PostConstruct
    public void initialize() {
        for (DataSourceConfig seed : sourceConfigLoader.loadAll()) {
            SourceConfigValidator.validate(seed);
            Optional<DataSourceConfig> persisted = sourceConfigRepository.find(seed.sourceCode());
            if (persisted.isPresent() && persisted.get().equals(seed)) {
                continue;
            }
            if (persisted.isPresent()
                    && versionRepository.hasVersions(seed.sourceCode())
                    && !isAdditiveChange(persisted.get(), seed)) {
                log.warn("Ignoring seed change for source {}: it is referenced by existing versions", seed.sourceCode());
                continue;
            }
            sourceConfigRepository.save(seed);
        }

        for (DataSourceConfig config : sourceConfigRepository.findAll()) {
            sourceSchemaManager.ensureDataTable(config);
            configs.put(config.sourceCode(), config);
        }
        log.info("Source registry ready. sources={}", configs.size());
    }

    public DataSourceConfig resolve(String sourceCode) {
        if (sourceCode == null || sourceCode.isBlank()) {
            throw new UnknownSourceException(sourceCode);
        }
        String code = sourceCode.trim().toUpperCase(Locale.ROOT);
        DataSourceConfig cached = configs.get(code);
        if (cached != null) {
            return cached;
        }

        // Another node may have registered it.
        Optional<DataSourceConfig> persisted = sourceConfigRepository.find(code);
        if (persisted.isEmpty()) {
            throw new UnknownSourceException(code);
        }
        sourceSchemaManager.ensureDataTable(persisted.get());
        configs.put(code, persisted.get());
        return persisted.get();
    }

    public List<DataSourceConfig> listSources() {
        List<DataSourceConfig> result = new ArrayList<>(configs.values());
        result.sort(Comparator.comparing(DataSourceConfig::sourceCode));
        return result;
    }

    /**
     * Registers a new source or replaces an existing one. The source becomes resolvable immediately.
     */
    public synchronized DataSourceConfig register(DataSourceConfig config) {
        SourceConfigValidator.validate(config);
        Optional<DataSourceConfig> existing = findExisting(config.sourceCode());
        if (existing.isPresent()
                && versionRepository.hasVersions(config.sourceCode())
                && !isAdditiveChange(existing.get(), config)) {
            throw new IllegalStateException(SourceConstants.MSG_SOURCE_IMMUTABLE.formatted(config.sourceCode()));
        }

        sourceConfigRepository.save(config);
        sourceSchemaManager.ensureDataTable(config);
        configs.put(config.sourceCode(), config);
        log.info("Registered source {} -> {} ({} columns)",
                config.sourceCode(), config.tableName(), config.columns().size());
        return config;
    }

    public synchronized DataSourceConfig addAliases(String sourceCode, String columnName, List<String> aliases) {
        DataSourceConfig current = resolve(sourceCode);
        DataSourceConfig updated = current.withAdditionalAliases(columnName, aliases == null ? List.of() : aliases);
        SourceConfigValidator.validate(updated);

        sourceConfigRepository.save(updated);
        configs.put(updated.sourceCode(), updated);
        log.info("Added aliases {} to {}.{}", aliases, updated.sourceCode(), columnName);
        return updated;
    }

    private Optional<DataSourceConfig> findExisting(String sourceCode) {
        DataSourceConfig cached = configs.get(sourceCode);
        return cached != null ? Optional.of(cached) : sourceConfigRepository.find(sourceCode);
    }

    /**
     * True when {@code candidate} differs from {@code existing} only by extra aliases.
     */
    static boolean isAdditiveChange(DataSourceConfig existing, DataSourceConfig candidate) {
        if (!existing.withoutAliases().equals(candidate.withoutAliases())) {
            return false;
        }
        for (CanonicalColumn column : existing.columns()) {
            CanonicalColumn updated = candidate.column(column.name()).orElse(null);
            if (updated == null || !updated.aliases().containsAll(column.aliases())) {
                return false;
            }
        }
        return true;
    }
}
