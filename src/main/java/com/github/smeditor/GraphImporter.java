package com.github.smeditor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.smeditor.ModelException.Code;

/**
 * Converts the flat graph handed over by the diagram reader into items under the states and
 * transitions aggregates, registering every addressable item as it goes.
 *
 * Notes:<br>
 * 1. top level nodes stand for the machine's own boundary and are not turned into items, their
 * descendants are attached straight under the states aggregate<br>
 * 2. an item is registered before its children are visited, so the effective id of a parent is
 * fixed before any of its descendants or later siblings get processed<br>
 * 3. comments are registered under a generated id, their source id is not used. Every id
 * found in the graph is reserved up front so that generated ids never take one of them<br>
 * 4. edges are bound to their endpoints only after all nodes are in, following the configured
 * {@link EdgeImportMode}<br>
 */
final class GraphImporter {
  private static final Logger logger = LogManager.getLogger(GraphImporter.class.getSimpleName());

  private final ItemRegistry registry;
  private final ModelConfiguration config;

  GraphImporter(final ItemRegistry registry, final ModelConfiguration config) {
    this.registry = registry;
    this.config = config;
  }

  /**
   * Checks the structure of the graph without touching the tree. Any problem found here means
   * the reader handed over a malformed graph.
   */
  static void validate(final Graph graph) throws ModelException {
    if (graph == null) {
      throw new ModelException(Code.IMPORT_FAILURE, "No graph to import");
    }
    if (graph.getNodes() == null || graph.getEdges() == null) {
      throw new ModelException(Code.IMPORT_FAILURE, "Graph is missing its nodes or edges");
    }
    for (final GraphNode topLevel : graph.getNodes()) {
      // the boundary node is dropped on import, only its content has to be well formed
      if (topLevel == null) {
        throw new ModelException(Code.IMPORT_FAILURE, "Graph has a null top level node");
      }
      for (final GraphNode node : topLevel.getChildren()) {
        validate(node);
      }
    }
    for (final GraphEdge edge : graph.getEdges()) {
      if (edge == null || isEmpty(edge.getSourceId()) || isEmpty(edge.getTargetId())) {
        throw new ModelException(Code.IMPORT_FAILURE, "Edge without endpoints: " + edge);
      }
    }
  }

  private static void validate(final GraphNode node) throws ModelException {
    if (node == null || node.getType() == null || node.getRect() == null) {
      throw new ModelException(Code.IMPORT_FAILURE, "Node without type or geometry: " + node);
    }
    if (node.getType() != GraphNodeType.COMMENT && isEmpty(node.getId())) {
      throw new ModelException(Code.IMPORT_FAILURE, "Node without id: " + node);
    }
    for (final GraphNode child : node.getChildren()) {
      validate(child);
    }
  }

  /**
   * Imports the nodes and then the edges of an already validated graph.
   */
  ImportResult importGraph(final Graph graph, final Item statesRoot, final Item transitionsRoot)
      throws ModelException {
    final ImportResult.Builder tally = new ImportResult.Builder();
    for (final GraphNode topLevel : graph.getNodes()) {
      reserveIds(topLevel.getChildren());
    }
    for (final GraphEdge edge : graph.getEdges()) {
      registry.reserve(edge.getId());
    }
    for (final GraphNode topLevel : graph.getNodes()) {
      // the boundary node itself is dropped, only its content is kept
      addChildNodes(topLevel.getChildren(), statesRoot, tally);
    }
    final ModelException edgeFailure = importEdges(graph.getEdges(), transitionsRoot, tally);
    if (edgeFailure != null) {
      return tally.failure(edgeFailure);
    }
    return tally.success(String.format("Imported %d states, %d initial states, %d comments, "
        + "%d transitions", tally.states, tally.initialStates, tally.comments, tally.transitions));
  }

  private void reserveIds(final List<GraphNode> nodes) {
    for (final GraphNode node : nodes) {
      registry.reserve(node.getId());
      reserveIds(node.getChildren());
    }
  }

  private void addChildNodes(final List<GraphNode> nodes, final Item parentItem,
      final ImportResult.Builder tally) throws ModelException {
    for (final GraphNode node : nodes) {
      final Item item = convertNode(node, tally);
      parentItem.addChild(item);
      if (!node.getChildren().isEmpty()) {
        addChildNodes(node.getChildren(), item, tally);
      }
    }
  }

  private Item convertNode(final GraphNode node, final ImportResult.Builder tally)
      throws ModelException {
    final Item item;
    final String id;
    switch (node.getType()) {
      case INITIAL:
        item = new InitialStateItem(node.getId(), node.getRect().getPosition());
        id = node.getId();
        tally.initialStates++;
        break;
      case COMMENT:
        id = registry.generateId();
        item = new CommentItem(id, node.getBody(), node.getRect());
        tally.comments++;
        break;
      case STATE:
        String title = node.getTitle();
        if (isEmpty(title)) {
          title = config.getEmptyStateTitle();
        }
        item = new StateItem(node.getId(), title, trim(node.getBody()), node.getRect());
        id = node.getId();
        tally.states++;
        break;
      default:
        throw new ModelException(Code.IMPORT_FAILURE, "Unsupported node type " + node.getType());
    }
    register(id, item, tally);
    return item;
  }

  /**
   * Returns the failure that stopped the edge import or null if every edge got imported.
   */
  private ModelException importEdges(final List<GraphEdge> edges, final Item transitionsRoot,
      final ImportResult.Builder tally) throws ModelException {
    switch (config.getEdgeImportMode()) {
      case VALIDATE_THEN_APPLY:
        final List<ResolvedEdge> resolved = new ArrayList<>(edges.size());
        for (final GraphEdge edge : edges) {
          final ResolvedEdge resolvedEdge = resolve(edge);
          if (resolvedEdge == null) {
            return unresolved(edge, tally);
          }
          resolved.add(resolvedEdge);
        }
        for (final ResolvedEdge resolvedEdge : resolved) {
          addTransition(resolvedEdge, transitionsRoot, tally);
        }
        return null;
      case STOP_AT_FIRST_UNRESOLVED:
        for (final GraphEdge edge : edges) {
          final ResolvedEdge resolvedEdge = resolve(edge);
          if (resolvedEdge == null) {
            return unresolved(edge, tally);
          }
          addTransition(resolvedEdge, transitionsRoot, tally);
        }
        return null;
      default:
        throw new ModelException(Code.IMPORT_FAILURE,
            "Unsupported edge import mode " + config.getEdgeImportMode());
    }
  }

  private ResolvedEdge resolve(final GraphEdge edge) {
    final Optional<Item> source = resolveEndpoint(edge.getSourceId());
    final Optional<Item> target = resolveEndpoint(edge.getTargetId());
    if (!source.isPresent() || !target.isPresent()) {
      return null;
    }
    return new ResolvedEdge(edge, source.get(), target.get());
  }

  // only states and initial states can be the end of a transition
  private Optional<Item> resolveEndpoint(final String id) {
    final Optional<Item> item = registry.resolve(id);
    if (item.isPresent() && !item.get().getKind().isDraggable()) {
      return Optional.empty();
    }
    return item;
  }

  private ModelException unresolved(final GraphEdge edge, final ImportResult.Builder tally) {
    final String message = String.format(
        "Cannot load edge %s, endpoint %s -> %s is not a known state; imported %d of the "
            + "transitions",
        edge.getId(), edge.getSourceId(), edge.getTargetId(), tally.transitions);
    logger.warn(message);
    return new ModelException(Code.UNRESOLVED_ENDPOINT, message);
  }

  private void addTransition(final ResolvedEdge resolvedEdge, final Item transitionsRoot,
      final ImportResult.Builder tally) throws ModelException {
    final GraphEdge edge = resolvedEdge.edge;
    final String id = isEmpty(edge.getId()) ? registry.generateId() : edge.getId();
    final TransitionItem transition = new TransitionItem(id, resolvedEdge.source,
        resolvedEdge.target, trim(edge.getBody()), edge.getGeometry());
    register(id, transition, tally);
    transitionsRoot.addChild(transition);
    tally.transitions++;
  }

  private void register(final String id, final Item item, final ImportResult.Builder tally)
      throws ModelException {
    final String effectiveId = registry.register(id, item);
    if (!effectiveId.equals(id)) {
      tally.warn(String.format("Duplicate id %s of %s was registered as %s", id,
          item.getKind(), effectiveId));
    }
  }

  private static String trim(final String text) {
    return text == null ? "" : text.trim();
  }

  private static boolean isEmpty(final String text) {
    return text == null || text.isEmpty();
  }

  private static final class ResolvedEdge {
    private final GraphEdge edge;
    private final Item source;
    private final Item target;

    private ResolvedEdge(final GraphEdge edge, final Item source, final Item target) {
      this.edge = edge;
      this.source = source;
      this.target = target;
    }
  }
}
