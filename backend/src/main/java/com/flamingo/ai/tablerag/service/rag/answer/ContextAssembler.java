package com.flamingo.ai.tablerag.service.rag.answer;

import com.flamingo.ai.tablerag.service.rag.model.AssembledContext;
import com.flamingo.ai.tablerag.service.rag.model.IndexNode;
import com.flamingo.ai.tablerag.service.rag.model.RetrievalResult;
import com.flamingo.ai.tablerag.service.rag.model.TableNode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Turns retrieved nodes into the context block for the synthesizer.
 *
 * <p>Nodes keep retrieval order. Each is preceded by a source header naming its page or table file
 * so the model can cite it. Table image paths are collected once each, in order of first hit.
 */
@Component
public class ContextAssembler {

  public AssembledContext assemble(RetrievalResult result) {
    StringBuilder context = new StringBuilder();
    Set<String> images = new LinkedHashSet<>();

    for (IndexNode node : result.nodes()) {
      context.append("\n--- Source: ").append(sourceLabel(node)).append(" ---\n");
      context.append(node.text()).append("\n");

      if (node instanceof TableNode table) {
        images.add(table.imagePath());
      }
    }
    return new AssembledContext(context.toString(), new ArrayList<>(images));
  }

  static String sourceLabel(IndexNode node) {
    if (node instanceof TableNode table) {
      return "Table Image (" + table.fileName() + ")";
    }
    return "Text (Page " + (node.pageNumber() != null ? node.pageNumber() : "N/A") + ")";
  }
}
