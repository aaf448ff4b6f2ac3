package com.flamingo.ai.tablerag.api.rest;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.tablerag.config.RagConfig;
import com.flamingo.ai.tablerag.exception.GlobalExceptionHandler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@DisplayName("TableImageController Tests")
class TableImageControllerTest {

  @TempDir Path tempDir;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    ragConfig.getStorage().setTableOutputDir(tempDir.toString());
    mockMvc =
        MockMvcBuilders.standaloneSetup(new TableImageController(ragConfig))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should serve a cropped table as PNG")
  void shouldServeTableImage() throws Exception {
    byte[] png = {(byte) 0x89, 'P', 'N', 'G'};
    Files.write(tempDir.resolve("p4_table_2.png"), png);

    mockMvc
        .perform(get("/api/tables/p4_table_2.png"))
        .andExpect(status().isOk())
        .andExpect(content().contentType(MediaType.IMAGE_PNG))
        .andExpect(content().bytes(png));
  }

  @Test
  @DisplayName("Should return 404 for a table that does not exist")
  void shouldReturnNotFoundForMissingTable() throws Exception {
    mockMvc.perform(get("/api/tables/p9_table_9.png")).andExpect(status().isNotFound());
  }

  @Test
  @DisplayName("Should return 404 for names the extractor never produces")
  void shouldRejectForeignFileNames() throws Exception {
    Files.writeString(tempDir.resolve("secrets.txt"), "nope");

    mockMvc.perform(get("/api/tables/secrets.txt")).andExpect(status().isNotFound());
  }
}
