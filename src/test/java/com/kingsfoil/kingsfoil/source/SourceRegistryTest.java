package com.kingsfoil.kingsfoil.source;

import com.kingsfoil.kingsfoil.version.VersionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SourceRegistryTest {

    private SourceConfigRepository sourceConfigRepository;
    private SourceConfigLoader sourceConfigLoader;
    private SourceSchemaManager sourceSchemaManager;
    private VersionRepository versionRepository;
    private SourceRegistry sourceRegistry;

    @BeforeEach
    void setUp() {
        sourceConfigRepository = mock(SourceConfigRepository.class);
        sourceConfigLoader = mock(SourceConfigLoader.class);
        sourceSchemaManager = mock(SourceSchemaManager.class);
        versionRepository = mock(VersionRepository.class);
        sourceRegistry = new SourceRegistry(sourceConfigRepository, sourceConfigLoader, sourceSchemaManager, versionRepository);
    }

    @Test
    void shouldSeedNewSourcesAndPrepareTheirTables() {
        DataSourceConfig seed = gpci(List.of("WORK GPCI"));
        when(sourceConfigLoader.loadAll()).thenReturn(List.of(seed));
        when(sourceConfigRepository.find("PFS_GPCI")).thenReturn(Optional.empty());
        when(sourceConfigRepository.findAll()).thenReturn(List.of(seed));

        sourceRegistry.initialize();

        verify(sourceConfigRepository).save(seed);
        verify(sourceSchemaManager).ensureDataTable(seed);
        assertEquals(seed, sourceRegistry.resolve(" pfs_gpci "));
        assertEquals(List.of(seed), sourceRegistry.listSources());
    }

    @Test
    void shouldKeepPersistedConfigWhenSeedWouldBreakExistingVersions() {
        DataSourceConfig persisted = gpci(List.of("WORK GPCI"));
        DataSourceConfig seed = new DataSourceConfig("PFS_GPCI", "PFS - GPCI", "cms_pfs_gpci",
                List.of(new CanonicalColumn("locality_code", SemanticType.TEXT, true, List.of("LOCALITY")),
                        new CanonicalColumn("work_gpci", SemanticType.INTEGER, false, List.of("WORK GPCI"))),
                List.of("locality_code"), null, null, false, null, null);
        when(sourceConfigLoader.loadAll()).thenReturn(List.of(seed));
        when(sourceConfigRepository.find("PFS_GPCI")).thenReturn(Optional.of(persisted));
        when(versionRepository.hasVersions("PFS_GPCI")).thenReturn(true);
        when(sourceConfigRepository.findAll()).thenReturn(List.of(persisted));

        sourceRegistry.initialize();

        verify(sourceConfigRepository, never()).save(any());
        assertEquals(persisted, sourceRegistry.resolve("PFS_GPCI"));
    }

    @Test
    void shouldThrowForUnknownSource() {
        when(sourceConfigRepository.find("NOPE")).thenReturn(Optional.empty());

        UnknownSourceException ex = assertThrows(UnknownSourceException.class, () -> sourceRegistry.resolve("nope"));
        assertEquals("NOPE", ex.getSourceCode());
        assertThrows(UnknownSourceException.class, () -> sourceRegistry.resolve("  "));
    }

    @Test
    void shouldRejectStructuralChangeOnceVersionsExist() {
        DataSourceConfig existing = gpci(List.of("WORK GPCI"));
        when(sourceConfigRepository.find("PFS_GPCI")).thenReturn(Optional.of(existing));
        when(versionRepository.hasVersions("PFS_GPCI")).thenReturn(true);

        DataSourceConfig changedKey = new DataSourceConfig("PFS_GPCI", "PFS - GPCI", "cms_pfs_gpci",
                existing.columns(), List.of("locality_code", "work_gpci"), null, null, false, null, null);

        assertThrows(IllegalStateException.class, () -> sourceRegistry.register(changedKey));
        verify(sourceConfigRepository, never()).save(any());
    }

    @Test
    void shouldAcceptAliasAdditionsOnReferencedSource() {
        DataSourceConfig existing = gpci(List.of("WORK GPCI"));
        when(sourceConfigRepository.find("PFS_GPCI")).thenReturn(Optional.of(existing));
        when(versionRepository.hasVersions("PFS_GPCI")).thenReturn(true);

        DataSourceConfig updated = sourceRegistry.addAliases("PFS_GPCI", "work_gpci", List.of("PW GPCI", " "));

        assertEquals(List.of("WORK GPCI", "PW GPCI"), updated.column("work_gpci").orElseThrow().aliases());
        verify(sourceConfigRepository).save(updated);
        assertEquals(updated, sourceRegistry.resolve("PFS_GPCI"));
    }

    @Test
    void shouldRejectAliasClaimedByAnotherColumn() {
        DataSourceConfig existing = gpci(List.of("WORK GPCI"));
        when(sourceConfigRepository.find("PFS_GPCI")).thenReturn(Optional.of(existing));

        assertThrows(IllegalArgumentException.class,
                () -> sourceRegistry.addAliases("PFS_GPCI", "work_gpci", List.of("locality")));
        assertThrows(IllegalArgumentException.class,
                () -> sourceRegistry.addAliases("PFS_GPCI", "no_such_column", List.of("X")));
    }

    @Test
    void shouldRejectInvalidRegistrations() {
        DataSourceConfig badTable = new DataSourceConfig("BAD", "Bad", "drop table;",
                gpci(List.of()).columns(), null, null, null, false, null, null);
        DataSourceConfig unknownKey = new DataSourceConfig("BAD", "Bad", null,
                gpci(List.of()).columns(), List.of("missing"), null, null, false, null, null);
        DataSourceConfig reserved = new DataSourceConfig("BAD", "Bad", null,
                List.of(new CanonicalColumn("row_id", SemanticType.TEXT, true, List.of())),
                null, null, null, false, null, null);

        assertThrows(IllegalArgumentException.class, () -> sourceRegistry.register(badTable));
        assertThrows(IllegalArgumentException.class, () -> sourceRegistry.register(unknownKey));
        assertThrows(IllegalArgumentException.class, () -> sourceRegistry.register(reserved));

        DataSourceConfig upperCaseNumber = new DataSourceConfig("BAD", "Bad", null, gpci(List.of()).columns(),
                null, List.of(new SpecialValueRule("work_gpci", SpecialValueKind.UPPERCASE_CODE)),
                null, false, null, null);
        DataSourceConfig twoRules = new DataSourceConfig("BAD", "Bad", null, gpci(List.of()).columns(),
                null, List.of(new SpecialValueRule("locality_code", SpecialValueKind.UPPERCASE_CODE),
                        new SpecialValueRule("locality_code", SpecialValueKind.STAR_AS_NULL)),
                null, false, null, null);

        assertThrows(IllegalArgumentException.class, () -> sourceRegistry.register(upperCaseNumber));
        assertThrows(IllegalArgumentException.class, () -> sourceRegistry.register(twoRules));
    }

    @Test
    void shouldTreatOnlyAliasGrowthAsAdditive() {
        DataSourceConfig base = gpci(List.of("WORK GPCI"));

        assertTrue(SourceRegistry.isAdditiveChange(base, gpci(List.of("WORK GPCI", "PW GPCI"))));
        assertFalse(SourceRegistry.isAdditiveChange(base, gpci(List.of("PW GPCI"))));
        assertFalse(SourceRegistry.isAdditiveChange(base, new DataSourceConfig("PFS_GPCI", "Renamed", "cms_pfs_gpci",
                base.columns(), base.uniqueKey(), null, null, false, null, null)));
    }

    private static DataSourceConfig gpci(List<String> workAliases) {
        return new DataSourceConfig("PFS_GPCI", "PFS - GPCI", "cms_pfs_gpci",
                List.of(new CanonicalColumn("locality_code", SemanticType.TEXT, true, List.of("LOCALITY")),
                        new CanonicalColumn("work_gpci", SemanticType.NUMERIC, false, workAliases)),
                List.of("locality_code"), null, null, false, null, null);
    }
}
