package com.flamingo.ai.batchplanner.service.reader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads UTF-8 files relative to a project root. */
public class FileSystemContentReader implements FileContentReader {

  private final Path root;

  public FileSystemContentReader(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  @Override
  public String read(String path) throws IOException {
    Path resolved = root.resolve(path).normalize();
    if (!resolved.startsWith(root)) {
      throw new IOException("Path escapes project root: " + path);
    }
    return Files.readString(resolved, StandardCharsets.UTF_8);
  }

  public Path getRoot() {
    return root;
  }
}
