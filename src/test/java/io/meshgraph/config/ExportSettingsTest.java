package io.meshgraph.config;

import io.meshgraph.export.RssiPolicy;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

final class ExportSettingsTest {

    @Test
    void defaultsCoverStandardWindowsAndHorizons() {
        ExportSettings settings = ExportSettings.defaults();

        Assertions.assertEquals(5, settings.windows().size());
        Assertions.assertEquals(List.of(1, 7, 14, 30), settings.seriesDays());
        Assertions.assertEquals(RssiPolicy.LATEST, settings.rssiPolicy());
        Assertions.assertNotNull(settings.zone());
    }

    @Test
    void parsesWindowSpellings() {
        Assertions.assertEquals(Duration.ofMinutes(15), ExportSettings.parseWindow("15m"));
        Assertions.assertEquals(Duration.ofMinutes(30), ExportSettings.parseWindow("30min"));
        Assertions.assertEquals(Duration.ofHours(3), ExportSettings.parseWindow("3H"));
        Assertions.assertEquals(Duration.ofDays(1), ExportSettings.parseWindow("1d"));
        Assertions.assertEquals(Duration.ofHours(24), ExportSettings.parseWindow("PT24H"));
        Assertions.assertThrows(ConfigurationException.class, () -> ExportSettings.parseWindow("ten minutes"));
        Assertions.assertThrows(ConfigurationException.class, () -> ExportSettings.parseWindow("5w"));
    }

    @Test
    void windowLabelsMatchArtifactNames() {
        Assertions.assertEquals("15min", ExportSettings.windowLabel(Duration.ofMinutes(15)));
        Assertions.assertEquals("90min", ExportSettings.windowLabel(Duration.ofMinutes(90)));
        Assertions.assertEquals("1h", ExportSettings.windowLabel(Duration.ofHours(1)));
        Assertions.assertEquals("24h", ExportSettings.windowLabel(Duration.ofDays(1)));
    }

    @Test
    void rejectsNonPositiveValues() {
        Assertions.assertEquals(List.of(1, 7), ExportSettings.parseDays(" 1, 7 ,"));
        Assertions.assertThrows(ConfigurationException.class, () -> ExportSettings.parseDays("1,x"));
        Assertions.assertThrows(ConfigurationException.class,
                () -> new ExportSettings(List.of(Duration.ZERO), null, null, null));
        Assertions.assertThrows(ConfigurationException.class,
                () -> new ExportSettings(null, List.of(0), null, null));
        Assertions.assertThrows(ConfigurationException.class, () -> RssiPolicy.parse("median"));
        Assertions.assertEquals(RssiPolicy.MEAN, RssiPolicy.parse("Mean"));
    }
}
