package com.flamingo.ai.tablerag.api.rest;

import com.flamingo.ai.tablerag.config.RagConfig;
import com.flamingo.ai.tablerag.exception.TableImageNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller serving cropped table images from the artifact directory.
 *
 * <p>Only file names produced by the extractor are accepted, so a request can never reach outside
 * the artifact directory.
 */
@RestController
@RequestMapping("/api/tables")
@RequiredArgsConstructor
@Slf4j
public class TableImageController {

  private static final Pattern TABLE_FILE_NAME = Pattern.compile("p\\d+_table_\\d+\\.png");

  private final RagConfig ragConfig;

  @GetMapping("/{fileName}")
  public ResponseEntity<byte[]> getTableImage(@PathVariable String fileName) {
    if (!TABLE_FILE_NAME.matcher(fileName).matches()) {
      throw new TableImageNotFoundException(fileName);
    }

    Path directory = Path.of(ragConfig.getStorage().getTableOutputDir()).toAbsolutePath();
    Path filePath = directory.resolve(fileName).normalize();
    if (!filePath.startsWith(directory) || !Files.isRegularFile(filePath)) {
      throw new TableImageNotFoundException(fileName);
    }

    try {
      byte[] bytes = Files.readAllBytes(filePath);
      return ResponseEntity.ok().contentType(MediaType.IMAGE_PNG).body(bytes);
    } catch (IOException e) {
      log.error("Failed to read table image {}: {}", filePath, e.getMessage());
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
  }
}
