/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.nameguard.service.settings;

import ai.floedb.nameguard.validation.model.ValidationSettings;
import ai.floedb.nameguard.validation.spi.ValidationSettingsStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Keeps validation settings in a JSON document on local disk. The last loaded or saved value is
 * held in memory; an unreadable document yields the defaults and is retried on the next load.
 */
public class FileValidationSettingsStore implements ValidationSettingsStore {
  private static final Logger LOG = Logger.getLogger(FileValidationSettingsStore.class);

  private final Path path;
  private final ObjectMapper mapper;
  private volatile ValidationSettings loaded;

  public FileValidationSettingsStore(Path path, ObjectMapper mapper) {
    this.path = Objects.requireNonNull(path, "path");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public ValidationSettings load() {
    ValidationSettings current = loaded;
    if (current != null) {
      return current;
    }
    synchronized (this) {
      if (loaded != null) {
        return loaded;
      }
      if (!Files.exists(path)) {
        LOG.debugf("No validation settings at %s, using defaults", path);
        loaded = ValidationSettings.defaults();
        return loaded;
      }
      try {
        ValidationSettings read = mapper.readValue(path.toFile(), ValidationSettings.class);
        loaded = read == null ? ValidationSettings.defaults() : read;
        return loaded;
      } catch (IOException e) {
        LOG.errorf(e, "Error loading validation settings from %s", path);
        return ValidationSettings.defaults();
      }
    }
  }

  @Override
  public synchronized void save(ValidationSettings settings) {
    Objects.requireNonNull(settings, "settings");
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
      mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), settings);
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new UncheckedIOException("Error saving validation settings to " + path, e);
    }
    loaded = settings;
  }
}
