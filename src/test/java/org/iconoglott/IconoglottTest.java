package org.iconoglott;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class IconoglottTest {

    @Test
    void testComponentsShareConfiguration() {
        // Arrange
        Config config = ConfigFactory.parseString("iconoglott.canvas.default-tier = large")
                .withFallback(ConfigFactory.defaultReference());

        try (Iconoglott iconoglott = new Iconoglott(config)) {
            // Act
            String fromCompiler = iconoglott.compiler().render("rect");
            String fromTool = iconoglott.renderTool().render("rect");

            // Assert
            assertThat(fromCompiler).contains("width=\"96\"");
            assertThat(fromTool).isEqualTo(fromCompiler);
            assertThat(iconoglott.transport()).isNotNull();
        }
    }
}
