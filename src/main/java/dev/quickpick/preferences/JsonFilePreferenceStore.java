package dev.quickpick.preferences;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PreferenceStore} keeping every key in a single JSON object file.
 *
 * <p>Writes go to a sibling temporary file that is then moved over the original, so readers never
 * observe a half-written file. A file that does not parse as a JSON object is treated as empty by
 * {@link #put} (and replaced), but reported as an error by {@link #get}.
 */
public class JsonFilePreferenceStore implements PreferenceStore {

  private static final Logger log = LoggerFactory.getLogger(JsonFilePreferenceStore.class);

  private final Path file;
  private final ObjectMapper objectMapper;

  public JsonFilePreferenceStore(Path file, ObjectMapper objectMapper) {
    this.file = file;
    this.objectMapper = objectMapper;
  }

  @Override
  public synchronized Optional<String> get(String key) {
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    @Nullable JsonNode value = readAll().get(key);
    if (value == null || value.isNull()) {
      return Optional.empty();
    }
    return Optional.of(value.isTextual() ? value.asText() : value.toString());
  }

  @Override
  public synchronized void put(String key, String value) {
    ObjectNode root;
    if (Files.exists(file)) {
      try {
        root = readAll();
      } catch (PreferenceStoreException e) {
        log.warn("Replacing unreadable preference file {}: {}", file, e.getMessage());
        root = objectMapper.createObjectNode();
      }
    } else {
      root = objectMapper.createObjectNode();
    }
    root.put(key, value);
    write(root);
  }

  /** Returns the backing file. */
  public Path getFile() {
    return file;
  }

  private ObjectNode readAll() {
    try {
      JsonNode root = objectMapper.readTree(file.toFile());
      if (root == null || root.isMissingNode()) {
        return objectMapper.createObjectNode();
      }
      if (!root.isObject()) {
        throw new PreferenceStoreException(
            "Preference file " + file + " does not contain a JSON object",
            new IOException("unexpected root node type " + root.getNodeType()));
      }
      return (ObjectNode) root;
    } catch (IOException e) {
      throw new PreferenceStoreException("Failed to read preference file " + file, e);
    }
  }

  private void write(ObjectNode root) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path temp =
          Files.createTempFile(
              parent != null ? parent : Path.of("."), file.getFileName().toString(), ".tmp");
      try {
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), root);
        moveIntoPlace(temp);
      } finally {
        Files.deleteIfExists(temp);
      }
    } catch (IOException e) {
      throw new PreferenceStoreException("Failed to write preference file " + file, e);
    }
  }

  private void moveIntoPlace(Path temp) throws IOException {
    try {
      Files.move(
          temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move unsupported for {}, falling back to plain replace", file);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
