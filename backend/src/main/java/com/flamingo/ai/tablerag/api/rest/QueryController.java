package com.flamingo.ai.tablerag.api.rest;

import com.flamingo.ai.tablerag.api.dto.request.QueryRequest;
import com.flamingo.ai.tablerag.service.rag.QueryService;
import com.flamingo.ai.tablerag.service.rag.model.QueryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller answering questions about the ingested report. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class QueryController {

  private final QueryService queryService;

  /**
   * Answers a question. The body is always a {@link QueryResponse}; the status code reflects its
   * outcome (409 before ingest, 503 when the model provider fails).
   */
  @PostMapping("/query")
  public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
    QueryResponse response = queryService.query(request.getQuestion().strip());
    HttpStatus status =
        switch (response.status()) {
          case ANSWERED -> HttpStatus.OK;
          case NOT_INGESTED -> HttpStatus.CONFLICT;
          case FAILED -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    return ResponseEntity.status(status).body(response);
  }
}
