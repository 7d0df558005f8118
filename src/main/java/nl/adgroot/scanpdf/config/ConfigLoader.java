package nl.adgroot.scanpdf.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

public final class ConfigLoader {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final String DEFAULT_RESOURCE = "/config.json";

  private ConfigLoader() {
    // utility class
  }

  public static ExportConfig load(Path configPath) throws IOException {
    return MAPPER.readValue(configPath.toFile(), ExportConfig.class);
  }

  /** Loads the bundled config.json, or plain defaults when it is not on the classpath. */
  public static ExportConfig loadDefault() throws IOException {
    try (InputStream is = ConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (is == null) {
        return new ExportConfig();
      }
      return MAPPER.readValue(is, ExportConfig.class);
    }
  }

  public static ExportConfig parse(String json) throws IOException {
    return MAPPER.readValue(json, ExportConfig.class);
  }
}
