package me.golemcore.progression.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.progression.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.progression.domain.ProgressionCatalog;
import me.golemcore.progression.domain.model.LensBlockingReason;
import me.golemcore.progression.domain.model.LensStatus;
import me.golemcore.progression.domain.model.MapStatus;
import me.golemcore.progression.domain.model.PlaceGraph;
import me.golemcore.progression.domain.model.SliceContractStatus;
import me.golemcore.progression.infrastructure.config.AutoConfiguration;
import me.golemcore.progression.infrastructure.config.ProgressionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.mock.env.MockEnvironment;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorldLensServiceTest {

    private static final String USER = "alice";
    private static final String ENV_VAR = "UDOS_3D_WORLD_LENS_ENABLED";

    @TempDir
    Path tempDir;

    private ProgressionProperties properties;
    private LocalStorageAdapter storageAdapter;
    private ObjectMapper objectMapper;
    private PlaceGraph placeGraph;
    private MockEnvironment environment;
    private Clock clock;

    @BeforeEach
    void setUp() {
        properties = new ProgressionProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
        objectMapper = AutoConfiguration.objectMapper();
        placeGraph = new PlaceGraphLoader(objectMapper, new DefaultResourceLoader())
                .load(properties.getMap().getSeedLocation());
        environment = new MockEnvironment();
        clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
    }

    private WorldLensService newService() {
        return new WorldLensService(placeGraph, storageAdapter, objectMapper, environment, properties, clock);
    }

    private MapStatus at(String placeId) {
        return MapStatus.builder().ok(true).username(USER).currentPlaceId(placeId).build();
    }

    // ==================== Slice contract ====================

    @Test
    void shouldValidateDefaultSliceAgainstSeed() {
        SliceContractStatus contract = newService().validateSlice();

        assertTrue(contract.isValid());
        assertEquals(List.of("andes-pass", "lunar-gateway", "subterra-relay"), contract.getAllowedPlaceIds());
        assertTrue(contract.getDisconnectedPlaceIds().isEmpty());
    }

    @Test
    void shouldReportMissingMismatchedAndDisconnectedPlaces() {
        properties.getLens().getSlice().setAllowedPlaceIds(
                List.of("subterra-relay", "andes-pass", "catalog-harbor", "atlantis"));

        SliceContractStatus contract = newService().validateSlice();

        assertFalse(contract.isValid());
        assertEquals(List.of("atlantis"), contract.getMissingPlaceIds());
        assertEquals(List.of("catalog-harbor"), contract.getPrefixMismatchPlaceIds());
        assertEquals(List.of("catalog-harbor", "atlantis"), contract.getDisconnectedPlaceIds());
    }

    @Test
    void shouldTreatEverythingAsDisconnectedWhenEntryOutsideSlice() {
        properties.getLens().getSlice().setEntryPlaceId("deep-vault");

        SliceContractStatus contract = newService().validateSlice();

        assertFalse(contract.isValid());
        assertEquals(3, contract.getDisconnectedPlaceIds().size());
    }

    @Test
    void shouldNotReachThroughPlacesOutsideSlice() {
        properties.getLens().getSlice().setAllowedPlaceIds(List.of("subterra-relay", "lunar-gateway"));

        SliceContractStatus contract = newService().validateSlice();

        assertEquals(List.of("lunar-gateway"), contract.getDisconnectedPlaceIds());
    }

    // ==================== Status precedence ====================

    @Test
    void shouldBlockOnFeatureFlagFirst() {
        properties.getLens().getSlice().setAllowedPlaceIds(List.of("atlantis"));

        LensStatus status = newService().status(USER, null, false);

        assertFalse(status.isReady());
        assertEquals(LensBlockingReason.FEATURE_FLAG_DISABLED, status.getBlockingReason());
        assertEquals("state", status.getEnabledSource());
        assertEquals(ProgressionCatalog.SOURCE_SYSTEM_DEFAULT, status.getUpdatedBy());
    }

    @Test
    void shouldBlockOnProgressionGateThenSliceThenMap() {
        WorldLensService service = newService();
        service.setEnabled(true, "play:alice");

        assertEquals(LensBlockingReason.PROGRESSION_GATE_BLOCKED,
                service.status(USER, at("andes-pass"), false).getBlockingReason());
        assertEquals(LensBlockingReason.MAP_RUNTIME_UNAVAILABLE,
                service.status(USER, null, true).getBlockingReason());
        assertEquals(LensBlockingReason.OUTSIDE_SINGLE_REGION,
                service.status(USER, at("catalog-harbor"), true).getBlockingReason());

        properties.getLens().getSlice().setAllowedPlaceIds(List.of("atlantis"));
        assertEquals(LensBlockingReason.SLICE_CONTRACT_INVALID,
                newService().status(USER, at("andes-pass"), true).getBlockingReason());
    }

    @Test
    void shouldBeReadyInsideRegion() {
        WorldLensService service = newService();
        service.setEnabled(true, "play:alice");

        LensStatus status = service.status(USER, at("subterra-relay"), true);

        assertTrue(status.isReady());
        assertNull(status.getBlockingReason());
        assertTrue(status.isRegionActive());
        assertEquals("1.3.22", status.getVersion());
        assertEquals("v1.3.18", status.getContracts().get("locid"));
        assertEquals("play:alice", status.getUpdatedBy());
    }

    // ==================== Enablement ====================

    @Test
    void shouldPersistEnablement() {
        newService().setEnabled(true, "play:alice");

        WorldLensService restarted = newService();

        assertTrue(restarted.isEnabled());
    }

    @Test
    void shouldHonorEnvironmentOverride() {
        environment.setProperty(ENV_VAR, " YES ");

        LensStatus status = newService().status(USER, at("andes-pass"), true);

        assertTrue(status.isEnabled());
        assertEquals("env:" + ENV_VAR, status.getEnabledSource());
    }

    @Test
    void shouldLetEnvironmentDisableStoredFlag() {
        WorldLensService service = newService();
        service.setEnabled(true, "play:alice");
        environment.setProperty(ENV_VAR, "off");

        assertFalse(service.isEnabled());
    }

    @Test
    void shouldIgnoreUnrecognizedEnvironmentValue() {
        environment.setProperty(ENV_VAR, "maybe");

        assertFalse(newService().isEnabled());
        assertEquals("state", newService().status(USER, null, true).getEnabledSource());
    }
}
