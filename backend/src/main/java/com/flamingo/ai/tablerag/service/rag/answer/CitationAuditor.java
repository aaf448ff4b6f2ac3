package com.flamingo.ai.tablerag.service.rag.answer;

import com.flamingo.ai.tablerag.service.rag.model.CitationAudit;
import com.flamingo.ai.tablerag.service.rag.model.IndexNode;
import com.flamingo.ai.tablerag.service.rag.model.RetrievalResult;
import com.flamingo.ai.tablerag.service.rag.model.TableNode;
import com.flamingo.ai.tablerag.service.rag.model.TextNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Compares the citations in an answer with the nodes that were actually retrieved.
 *
 * <p>Report-only: the result is attached to the response and logged, the answer and the source
 * image list are never changed.
 */
@Component
@Slf4j
public class CitationAuditor {

  private static final Pattern PAGE_CITATION =
      Pattern.compile("\\b(?:Page|p\\.)\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern TABLE_CITATION = Pattern.compile("\\bp\\d+_table_\\d+\\.png\\b");

  public CitationAudit audit(String answer, RetrievalResult result) {
    if (answer == null || answer.isBlank()) {
      return CitationAudit.empty();
    }

    Set<Integer> retrievedPages = new HashSet<>();
    Set<String> retrievedTables = new HashSet<>();
    for (IndexNode node : result.nodes()) {
      if (node instanceof TableNode table) {
        retrievedTables.add(table.fileName());
      } else if (node instanceof TextNode text) {
        retrievedPages.add(text.pageNumber());
      }
    }

    Set<Integer> citedPages = new LinkedHashSet<>();
    Matcher pages = PAGE_CITATION.matcher(answer);
    while (pages.find()) {
      citedPages.add(Integer.parseInt(pages.group(1)));
    }

    Set<String> citedTables = new LinkedHashSet<>();
    Matcher tables = TABLE_CITATION.matcher(answer);
    while (tables.find()) {
      citedTables.add(tables.group());
    }

    List<String> unmatched = new ArrayList<>();
    for (Integer page : citedPages) {
      if (!retrievedPages.contains(page)) {
        unmatched.add("Page " + page);
      }
    }
    for (String table : citedTables) {
      if (!retrievedTables.contains(table)) {
        unmatched.add(table);
      }
    }

    if (citedPages.isEmpty() && citedTables.isEmpty()) {
      log.warn("Answer contains no page or table citations");
    } else if (!unmatched.isEmpty()) {
      log.warn("Answer cites sources that were not retrieved: {}", unmatched);
    }
    return new CitationAudit(new ArrayList<>(citedPages), new ArrayList<>(citedTables), unmatched);
  }
}
