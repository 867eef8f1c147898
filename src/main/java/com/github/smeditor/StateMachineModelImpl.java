package com.github.smeditor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.smeditor.ModelException.Code;

/**
 * Tree model of a hierarchical state machine diagram.
 *
 * Notes for users:<br>
 * 1. this model instance is not thread-safe, all calls are expected on the owning thread<br>
 *
 * 2. it is designed to not be singleton within a process, so, if there's a desire to have many
 * diagrams open, just create as many models as needed. Each one owns its own id registry<br>
 *
 * 3. the tree and the registry are torn down and rebuilt together, inside a single reset
 * notification bracket, so a view never sees one without the other. The state machine itself is
 * registered last, so its generated id cannot shadow an id read from the graph<br>
 *
 * 4. moves are announced as a removal followed by an insertion; the insertion row is the target
 * parent's child count at the time of insertion<br>
 */
public final class StateMachineModelImpl implements StateMachineModel {
  private static final Logger logger =
      LogManager.getLogger(StateMachineModelImpl.class.getSimpleName());

  private final String modelId = UUID.randomUUID().toString();

  private final ModelConfiguration config;
  private final ItemRegistry registry;
  private final ChangeNotifier notifier = new ChangeNotifier();

  // the fixed skeleton, replaced as a whole on every reset
  private RootItem root;
  private StateMachineItem smRoot;
  private Item statesRoot;
  private Item transitionsRoot;

  private String formatVersion;

  StateMachineModelImpl(final ModelConfiguration config) {
    this.config = config;
    this.registry =
        new ItemRegistry(config.getIdCollisionSuffix(), config.getGeneratedIdPrefix());
    initTrees();
    registerStateMachine();
    logInfo(modelId, "Created state machine model with " + config);
  }

  private void initTrees() {
    root = new RootItem(config.getDefaultMachineName());
    smRoot = root.getStateMachine();
    statesRoot = smRoot.child(0);
    transitionsRoot = smRoot.child(1);
    formatVersion = null;
  }

  private void registerStateMachine() {
    registry.registerGenerated(smRoot);
  }

  private void cleanupTrees() {
    registry.clear();
    root = null;
    smRoot = null;
    statesRoot = transitionsRoot = null;
  }

  @Override
  public void reset() {
    try (StructuralChange change = StructuralChange.reset(notifier)) {
      cleanupTrees();
      initTrees();
      registerStateMachine();
    }
    logDebug(modelId, "Model reset");
  }

  @Override
  public ImportResult loadGraph(final Graph graph) {
    ImportResult result;
    try (StructuralChange change = StructuralChange.reset(notifier)) {
      cleanupTrees();
      initTrees();
      result = populate(graph);
      registerStateMachine();
    }
    return result;
  }

  @Override
  public ImportResult loadGraph(final GraphSource source) {
    ImportResult result;
    try (StructuralChange change = StructuralChange.reset(notifier)) {
      cleanupTrees();
      initTrees();
      Graph graph;
      try {
        graph = source.read();
      } catch (IOException | RuntimeException exception) {
        logError(modelId, "Cannot load state machine graph", exception);
        registerStateMachine();
        return new ImportResult.Builder()
            .failure(new ModelException(Code.IMPORT_FAILURE, exception));
      }
      result = populate(graph);
      registerStateMachine();
    }
    return result;
  }

  /**
   * Fills the freshly reset tree. Runs inside the reset bracket of the caller.
   */
  private ImportResult populate(final Graph graph) {
    try {
      GraphImporter.validate(graph);
    } catch (ModelException malformed) {
      logError(modelId, "Cannot load state machine graph: " + malformed.getMessage());
      return new ImportResult.Builder().failure(malformed);
    }

    final GraphMetadata metadata = graph.getMetadata();
    if (metadata != null) {
      formatVersion = metadata.getFormatVersion();
      if (metadata.getName() != null && !metadata.getName().isEmpty()) {
        smRoot.rename(metadata.getName());
      }
    }

    ImportResult result;
    try {
      result = new GraphImporter(registry, config).importGraph(graph, statesRoot,
          transitionsRoot);
    } catch (ModelException problem) {
      // leave nothing half built behind
      logError(modelId, "Failed while importing state machine graph", problem);
      cleanupTrees();
      initTrees();
      return new ImportResult.Builder().failure(problem);
    }
    if (result.isSuccessful()) {
      logInfo(modelId, result.getDescription());
    } else {
      logWarning(modelId, "Graph loaded with errors: " + result.getDescription());
    }
    for (final String warning : result.getWarnings()) {
      logWarning(modelId, warning);
    }
    return result;
  }

  @Override
  public String getId() {
    return modelId;
  }

  @Override
  public ModelConfiguration getConfiguration() {
    return config;
  }

  @Override
  public String getStateMachineName() {
    return smRoot.getTitle();
  }

  @Override
  public String getFormatVersion() {
    return formatVersion;
  }

  @Override
  public boolean renameStateMachine(final String name) {
    if (name == null || name.isEmpty()) {
      return false;
    }
    smRoot.rename(name);
    notifier.dataChanged(stateMachineAddress());
    return true;
  }

  @Override
  public void addListener(final ItemModelListener listener) {
    notifier.addListener(listener);
  }

  @Override
  public void removeListener(final ItemModelListener listener) {
    notifier.removeListener(listener);
  }

  @Override
  public int rowCount(final ItemAddress parent) {
    if (parent.getColumn() > 0) {
      return 0;
    }
    final Item item;
    if (!parent.isValid() || parent.equals(rootAddress())) {
      item = root;
    } else {
      item = parent.getItem();
    }
    return item.childCount();
  }

  @Override
  public int columnCount(final ItemAddress parent) {
    return 1;
  }

  @Override
  public boolean hasChildren(final ItemAddress parent) {
    return rowCount(parent) > 0;
  }

  @Override
  public boolean hasIndex(final int row, final int column, final ItemAddress parent) {
    if (column != 0) {
      return false;
    }
    if (!parent.isValid()) {
      return row == 0;
    }
    final Item parentItem = parent.getItem();
    return row >= 0 && row < parentItem.childCount();
  }

  @Override
  public ItemAddress index(final int row, final int column, final ItemAddress parent) {
    if (!parent.isValid() || !hasIndex(row, column, parent)) {
      return ItemAddress.INVALID;
    }
    return new ItemAddress(row, column, parent.getItem().child(row));
  }

  @Override
  public ItemAddress parent(final ItemAddress address) {
    if (!address.isValid() || address.getItem() == root) {
      return ItemAddress.INVALID;
    }
    if (address.getItem() == smRoot) {
      return rootAddress();
    }
    final Item parentItem = address.getItem().parent();
    if (parentItem == null) {
      return ItemAddress.INVALID;
    }
    if (parentItem == root) {
      return rootAddress();
    }
    return new ItemAddress(parentItem.row(), 0, parentItem);
  }

  @Override
  public ItemAddress itemToAddress(final Item item) {
    if (item == null) {
      return ItemAddress.INVALID;
    }
    if (item == root) {
      return rootAddress();
    }
    if (item.parent() == null) {
      // detached or from a previous tree
      return ItemAddress.INVALID;
    }
    return new ItemAddress(item.row(), 0, item);
  }

  @Override
  public Item addressToItem(final ItemAddress address) {
    if (!address.isValid()) {
      return root;
    }
    return address.getItem();
  }

  @Override
  public ItemAddress rootAddress() {
    return new ItemAddress(0, 0, root);
  }

  @Override
  public ItemAddress stateMachineAddress() {
    return new ItemAddress(0, 0, smRoot);
  }

  @Override
  public ItemAddress statesRootAddress() {
    return new ItemAddress(0, 0, statesRoot);
  }

  @Override
  public ItemAddress transitionsRootAddress() {
    return new ItemAddress(1, 0, transitionsRoot);
  }

  @Override
  public boolean isTrivialAddress(final ItemAddress address) {
    return !address.isValid() || address.equals(rootAddress())
        || address.equals(stateMachineAddress()) || address.equals(statesRootAddress())
        || address.equals(transitionsRootAddress());
  }

  @Override
  public boolean isStateAddress(final ItemAddress address) {
    return isKind(address, ItemKind.STATE);
  }

  @Override
  public boolean isInitialStateAddress(final ItemAddress address) {
    return isKind(address, ItemKind.INITIAL_STATE);
  }

  @Override
  public boolean isTransitionAddress(final ItemAddress address) {
    return isKind(address, ItemKind.TRANSITION);
  }

  @Override
  public boolean isActionAddress(final ItemAddress address) {
    return isKind(address, ItemKind.ACTION);
  }

  @Override
  public boolean isCommentAddress(final ItemAddress address) {
    return isKind(address, ItemKind.COMMENT);
  }

  private static boolean isKind(final ItemAddress address, final ItemKind kind) {
    return address.isValid() && address.getItem().getKind() == kind;
  }

  @Override
  public String data(final ItemAddress address) {
    if (!address.isValid() || address.getColumn() != 0 || address.getItem() == root) {
      return null;
    }
    return address.getItem().getTitle();
  }

  @Override
  public EnumSet<ItemFlag> flags(final ItemAddress address) {
    final EnumSet<ItemFlag> flags = EnumSet.of(ItemFlag.ENABLED, ItemFlag.SELECTABLE);
    if (!address.isValid()) {
      return flags;
    }
    switch (address.getItem().getKind()) {
      case STATES_AGGREGATE:
        flags.add(ItemFlag.DROP_ENABLED);
        break;
      case STATE:
        flags.add(ItemFlag.DRAG_ENABLED);
        flags.add(ItemFlag.DROP_ENABLED);
        flags.add(ItemFlag.EDITABLE);
        break;
      case INITIAL_STATE:
        flags.add(ItemFlag.DRAG_ENABLED);
        break;
      case STATE_MACHINE_ROOT:
      case ACTION:
        flags.add(ItemFlag.EDITABLE);
        break;
      case ROOT:
      case TRANSITIONS_AGGREGATE:
      case COMMENT:
      case TRANSITION:
        break;
      default:
        throw new IllegalStateException("Unhandled item kind " + address.getItem().getKind());
    }
    return flags;
  }

  @Override
  public boolean setData(final ItemAddress address, final String value) {
    if (!address.isValid() || address.getColumn() != 0 || value == null
        || !owns(address.getItem())) {
      logWarning(modelId, "Rename rejected for " + address);
      return false;
    }
    final Item item = address.getItem();
    switch (item.getKind()) {
      case STATE_MACHINE_ROOT:
        if (value.isEmpty()) {
          logWarning(modelId, "Rename rejected, state machine name cannot be empty");
          return false;
        }
        smRoot.rename(value);
        break;
      case STATE:
        if (value.isEmpty()) {
          logWarning(modelId, "Rename rejected, state title cannot be empty: " + item);
          return false;
        }
        ((StateItem) item).rename(value);
        break;
      case ACTION:
        ((ActionItem) item).rename(value);
        break;
      case ROOT:
      case STATES_AGGREGATE:
      case TRANSITIONS_AGGREGATE:
      case INITIAL_STATE:
      case COMMENT:
      case TRANSITION:
        logWarning(modelId, "Rename rejected, item is not editable: " + item);
        return false;
      default:
        throw new IllegalStateException("Unhandled item kind " + item.getKind());
    }
    notifier.dataChanged(address);
    return true;
  }

  @Override
  public Optional<Item> idToItem(final String id) {
    return registry.resolve(id);
  }

  @Override
  public boolean move(final Item item, final Item targetParent) throws ModelException {
    checkMovable(item, targetParent);
    final Item sourceParent = item.parent();
    if (sourceParent == targetParent) {
      logDebug(modelId, "Ignoring move of " + item + " onto its own parent");
      return false;
    }

    final ItemAddress sourceAddress = itemToAddress(sourceParent);
    final int removeRow = item.row();
    RuntimeException listenerFailure = null;
    try (StructuralChange change =
        StructuralChange.removeRows(notifier, sourceAddress, removeRow, removeRow)) {
      sourceParent.removeChild(item);
    } catch (RuntimeException problem) {
      listenerFailure = problem;
    }
    if (item.parent() == sourceParent) {
      // refused before anything was detached
      logError(modelId, "Move of " + item.getId() + " aborted by a listener", listenerFailure);
      throw listenerFailure;
    }

    // the target may have shifted up if it was a later sibling of the moved item
    final ItemAddress targetAddress = itemToAddress(targetParent);
    final int addRow = targetParent.childCount();
    try (StructuralChange change =
        StructuralChange.insertRows(notifier, targetAddress, addRow, addRow)) {
      targetParent.addChild(item);
    } catch (RuntimeException problem) {
      if (listenerFailure == null) {
        listenerFailure = problem;
      } else {
        listenerFailure.addSuppressed(problem);
      }
    }
    if (item.parent() == null) {
      // a detached item would still resolve through the registry
      targetParent.addChild(item);
    }
    if (listenerFailure != null) {
      logError(modelId, "Moved " + item.getId() + " but a listener failed", listenerFailure);
      throw listenerFailure;
    }
    logDebug(modelId, String.format("Moved %s from %s[%d] to %s[%d]", item.getId(),
        sourceParent.getTitle(), removeRow, targetParent.getTitle(), addRow));
    return true;
  }

  private void checkMovable(final Item item, final Item targetParent) throws ModelException {
    if (item == null || targetParent == null) {
      throw new ModelException(Code.INVALID_MOVE, "Cannot move " + item + " to " + targetParent);
    }
    if (!owns(item) || !owns(targetParent)) {
      throw new ModelException(Code.INVALID_MOVE,
          "Item or target does not belong to model " + modelId);
    }
    if (!item.getKind().isDraggable()) {
      throw new ModelException(Code.INVALID_MOVE, "Only states can be moved, not " + item);
    }
    if (targetParent.getKind() != ItemKind.STATES_AGGREGATE
        && targetParent.getKind() != ItemKind.STATE) {
      throw new ModelException(Code.INVALID_MOVE, "Cannot move states under " + targetParent);
    }
    if (item == targetParent || item.isAncestorOf(targetParent)) {
      throw new ModelException(Code.INVALID_MOVE,
          "Cannot move " + item + " into its own subtree");
    }
  }

  @Override
  public List<String> mimeTypes() {
    return Collections.singletonList(DragPayload.STATE_MIME_TYPE);
  }

  @Override
  public EnumSet<DropAction> supportedDropActions() {
    return EnumSet.of(DropAction.MOVE);
  }

  @Override
  public DragPayload mimeData(final List<ItemAddress> addresses) {
    final List<String> ids = new ArrayList<>();
    for (final ItemAddress address : addresses) {
      if (!address.isValid() || address.getColumn() != 0) {
        continue;
      }
      if (!address.getItem().getKind().isDraggable()) {
        continue;
      }
      ids.add(address.getItem().getId());
    }
    return DragPayload.ofStates(ids);
  }

  @Override
  public boolean dropMimeData(final DragPayload payload, final DropAction action, final int row,
      final int column, final ItemAddress parent) throws ModelException {
    if (action == DropAction.IGNORE) {
      return true;
    }
    if (action != DropAction.MOVE || column > 0 || payload == null
        || !payload.hasFormat(DragPayload.STATE_MIME_TYPE) || !parent.isValid()) {
      return false;
    }
    final Item target = parent.getItem();
    if (target.getKind() != ItemKind.STATES_AGGREGATE && target.getKind() != ItemKind.STATE) {
      logWarning(modelId, "Drop rejected, cannot drop states on " + target);
      return false;
    }

    // resolve and check everything before touching the tree
    final List<Item> items = new ArrayList<>(payload.getIds().size());
    for (final String id : payload.getIds()) {
      final Optional<Item> item = registry.resolve(id);
      if (!item.isPresent()) {
        logWarning(modelId, "Drop rejected, unknown id " + id);
        return false;
      }
      if (!item.get().getKind().isDraggable() || item.get() == target
          || item.get().isAncestorOf(target)) {
        logWarning(modelId, "Drop rejected, cannot move " + item.get() + " to " + target);
        return false;
      }
      items.add(item.get());
    }

    for (final Item item : items) {
      if (item.parent() == target) {
        continue;
      }
      move(item, target);
    }
    return true;
  }

  @Override
  public String dump() {
    final StringBuilder builder = new StringBuilder();
    dumpRecursively(root, "", builder);
    final String dump = builder.toString();
    logDebug(modelId, "Model tree:\n" + dump);
    return dump;
  }

  private static void dumpRecursively(final Item item, final String indent,
      final StringBuilder builder) {
    builder.append(indent).append(item.getKind());
    if (item.getId() != null) {
      builder.append(' ').append(item.getId());
    }
    builder.append(" {").append(item.getTitle()).append("}\n");
    final String childIndent = indent + "-";
    for (int row = 0; row < item.childCount(); row++) {
      dumpRecursively(item.child(row), childIndent, builder);
    }
  }

  private boolean owns(final Item item) {
    Item current = item;
    while (current != null && current.parent() != null) {
      current = current.parent();
    }
    return current == root;
  }

  private static void logError(final String modelId, final String message) {
    logger.error(new StringBuilder().append("[m:").append(modelId).append("] ").append(message)
        .toString());
  }

  private static void logError(final String modelId, final String message,
      final Throwable error) {
    logger.error(new StringBuilder().append("[m:").append(modelId).append("] ").append(message)
        .toString(), error);
  }

  private static void logWarning(final String modelId, final String message) {
    logger.warn(new StringBuilder().append("[m:").append(modelId).append("] ").append(message)
        .toString());
  }

  private static void logInfo(final String modelId, final String message) {
    logger.info(new StringBuilder().append("[m:").append(modelId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String modelId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(modelId).append("] ")
          .append(message).toString());
    }
  }
}
