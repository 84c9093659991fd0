// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Level;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.dexopt.cfg.CFGTraversal;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;
import org.sosy_lab.dexopt.cfg.EdgeOrdering;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.cfg.model.Edge;
import org.sosy_lab.dexopt.cfg.model.EdgeType;
import org.sosy_lab.dexopt.ir.DexMethod;
import org.sosy_lab.dexopt.ir.DexType;

/** This Writer can dump the CFGs of methods with their source blocks into dot files. */
public class SourceBlockToDotWriter {

  private final ImmutableList<DexMethod> methods;

  public SourceBlockToDotWriter(Collection<DexMethod> pMethods) {
    methods = ImmutableList.copyOf(pMethods);
  }

  /** Dump one file per method with code; hot blocks are filled. */
  public void dump(final Path pDir, LogManager pLogger) {
    try {
      MoreFiles.createParentDirectories(pDir.resolve("sb"));
    } catch (IOException e) {
      pLogger.logUserException(
          Level.WARNING, e, "Could not create directory to write source blocks to dot files");
      return;
    }

    for (DexMethod method : methods) {
      ControlFlowGraph code = method.getCode();
      if (code == null) {
        continue;
      }
      Path file = pDir.resolve("sb__" + fileName(method) + ".dot");
      try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
        dump(w, method.toString(), code);
      } catch (IOException e) {
        pLogger.logUserException(
            Level.WARNING, e, "Could not write source blocks of " + method + " to dot file");
        // ignore exception and continue with the next method
      }
    }
  }

  static void dump(final Appendable app, String pName, ControlFlowGraph pCfg) throws IOException {
    app.append("digraph \"" + escape(pName) + "\" {\n");
    final List<Edge> edges = new ArrayList<>();

    // nodes in traversal order, so that the layout follows the source block ids
    for (Block b : CFGTraversal.blocksInOrder(pCfg)) {
      app.append(formatNode(b));
      edges.addAll(EdgeOrdering.sortedLeavingEdges(b));
    }

    // we have to dump edges after the nodes, targets of back edges are not yet known before
    for (Edge edge : edges) {
      app.append(formatEdge(edge));
    }
    app.append("}\n");
  }

  private static String formatNode(Block pBlock) {
    StringBuilder label = new StringBuilder().append(pBlock);
    for (SourceBlock sb : pBlock.sourceBlockEntries()) {
      label.append("\\n").append(escape(sb.toString()));
    }
    String style = SourceBlocks.isBlockHot(pBlock) ? "style=filled fillcolor=orange " : "";
    return pBlock.getId() + " [shape=box " + style + "label=\"" + label + "\"]\n";
  }

  private static String formatEdge(Edge pEdge) {
    StringBuilder sb = new StringBuilder();
    sb.append(pEdge.getSrc().getId());
    sb.append(" -> ");
    sb.append(pEdge.getTarget().getId());
    if (pEdge.getType() == EdgeType.GHOST) {
      sb.append(" [style=\"dotted\"]");
    } else {
      sb.append(" [label=\"").append(pEdge.getType().getTag());
      if (pEdge.getCaseKey() != null) {
        sb.append(' ').append(pEdge.getCaseKey());
      }
      if (pEdge.getType() == EdgeType.THROW) {
        DexType catchType = pEdge.getCatchType();
        sb.append(' ').append(catchType == null ? "*" : escape(catchType.getDescriptor()));
      }
      sb.append("\"");
      if (pEdge.getType() == EdgeType.THROW) {
        sb.append(" style=\"dashed\"");
      }
      sb.append("]");
    }
    return sb.append('\n').toString();
  }

  private static String escape(String pText) {
    return pText.replace("\\", "\\\\").replace("\"", "\\\"");
  }

  private static String fileName(DexMethod pMethod) {
    return pMethod.toString().replaceAll("[^A-Za-z0-9_$.-]", "_");
  }
}
