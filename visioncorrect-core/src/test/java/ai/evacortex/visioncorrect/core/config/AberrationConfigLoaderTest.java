/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.config;

import ai.evacortex.visioncorrect.core.exceptions.ConfigurationException;
import ai.evacortex.visioncorrect.core.image.LuminanceMapping;
import ai.evacortex.visioncorrect.core.optics.Prescription;
import ai.evacortex.visioncorrect.core.pipeline.Eye;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AberrationConfigLoaderTest {

    private final AberrationConfigLoader loader = new AberrationConfigLoader();

    @TempDir
    Path tempDir;

    @Test
    void loadsPartialFile_withDefaults() throws IOException {
        Path file = tempDir.resolve("rx.json");
        Files.writeString(file, "{\"od\": {\"sphere\": -2.0, \"cylinder\": -0.5, \"axis\": 90},"
                + " \"settings\": {\"kernelSize\": 128, \"luminanceMapping\": \"GLOBAL_REMAP\"}}");

        AberrationConfig config = loader.load(file);
        assertEquals(Prescription.of(-2.0, -0.5, 90.0), config.od());
        assertEquals(Prescription.emmetropic(), config.os());
        assertEquals(128, config.settings().kernelSize());
        assertEquals(OpticsSettings.DEFAULT_WAVELENGTH_NM, config.settings().wavelengthNm());
        assertEquals(LuminanceMapping.GLOBAL_REMAP, config.settings().luminanceMapping());
        assertSame(config.od(), config.prescription(Eye.OD));
    }

    @Test
    void loadsClasspathFixture() {
        AberrationConfig config = loader.loadResource("aberration-fixture.json");
        assertEquals(-3.25, config.od().sphere());
        assertEquals(-1.5, config.os().sphere());
        assertEquals(45.0, config.os().axis());
        assertEquals(3.0, config.os().pupilRadius());
        assertEquals(64, config.settings().kernelSize());
    }

    @Test
    void defaultResource_isEmmetropic() {
        AberrationConfig config = loader.loadDefault();
        assertEquals(Prescription.emmetropic(), config.od());
        assertEquals(Prescription.emmetropic(), config.os());
        assertEquals(OpticsSettings.DEFAULT_KERNEL_SIZE, config.settings().kernelSize());
        assertEquals(OpticsSettings.DEFAULT_EPSILON, config.settings().epsilon());
    }

    @Test
    void saveThenLoad() {
        AberrationConfig config = new AberrationConfig(
                new Prescription(-1.25, -0.75, 170.0, 2.0, 1.25),
                Prescription.of(-1.0, 0.0, 0.0),
                new OpticsSettings(256, 560.0, 3e-5, 5e-3, LuminanceMapping.DIRECT_CLAMP));
        Path file = tempDir.resolve("nested").resolve("saved.json");
        loader.save(config, file);
        assertEquals(config, loader.load(file));
    }

    @Test
    void unknownField_isRejected() throws IOException {
        Path file = tempDir.resolve("typo.json");
        Files.writeString(file, "{\"od\": {\"sphear\": -2.0}}");
        assertThrows(ConfigurationException.class, () -> loader.load(file));
    }

    @Test
    void invalidValue_isRejected() throws IOException {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "{\"os\": {\"pupilRadius\": -1.0}}");
        assertThrows(ConfigurationException.class, () -> loader.load(file));
    }

    @Test
    void malformedOrMissing_isRejected() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"od\": ");
        assertThrows(ConfigurationException.class, () -> loader.load(file));
        assertThrows(ConfigurationException.class, () -> loader.load(tempDir.resolve("absent.json")));
        assertThrows(ConfigurationException.class, () -> loader.loadResource("no-such-config.json"));
    }
}
