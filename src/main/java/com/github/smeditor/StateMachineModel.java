package com.github.smeditor;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Tree model of a hierarchical state machine diagram, the piece a generic tree view is built
 * against.
 *
 * Notes for users:<br>
 * 0a. the diagram is a graph (states nested in states, transitions between any two states,
 * free comments); this model projects it onto a fixed tree: root, state machine, then the states
 * aggregate at row 0 and the transitions aggregate at row 1<br>
 * 0b. transitions are always flat under the transitions aggregate, whatever the nesting of their
 * endpoints<br>
 *
 * 1. this model is not thread-safe. It's meant to be owned and driven by a single thread, the
 * one that also receives the notifications<br>
 *
 * 2. {@link #reset()} and {@link #loadGraph(Graph)} rebuild the tree and the id registry
 * together. Every address and item obtained before is stale afterwards<br>
 *
 * 3. an address is a (row, column, item) triple. Only column 0 exists<br>
 *
 * 4. structural changes (reset, move) are announced to listeners in matching about-to/done
 * pairs that never overlap<br>
 *
 * 5. ids are unique. A colliding id read from a diagram is renamed with a suffix and the import
 * result reports it<br>
 */
public interface StateMachineModel {

  ///// Lifecycle /////
  /**
   * Drop the whole tree and registry and start over with an empty state machine.
   */
  void reset();

  /**
   * Reset the model and fill it from the given graph. Failures are reported in the result, the
   * model is left empty when the graph is malformed.
   */
  ImportResult loadGraph(final Graph graph);

  /**
   * Reset the model and fill it from whatever the source reads. A source that fails to read
   * leaves the model empty.
   */
  ImportResult loadGraph(final GraphSource source);

  /**
   * Reports the id of this model instance.
   */
  String getId();

  ModelConfiguration getConfiguration();

  String getStateMachineName();

  /**
   * Format version of the last loaded graph, null if nothing was loaded.
   */
  String getFormatVersion();

  /**
   * Rename the state machine. Empty names are ignored and false is returned.
   */
  boolean renameStateMachine(final String name);

  void addListener(final ItemModelListener listener);

  void removeListener(final ItemModelListener listener);


  ///// Address translation /////
  int rowCount(final ItemAddress parent);

  int columnCount(final ItemAddress parent);

  boolean hasChildren(final ItemAddress parent);

  boolean hasIndex(final int row, final int column, final ItemAddress parent);

  /**
   * Address of the child at row/column of parent, or {@link ItemAddress#INVALID}.
   */
  ItemAddress index(final int row, final int column, final ItemAddress parent);

  ItemAddress parent(final ItemAddress address);

  ItemAddress itemToAddress(final Item item);

  /**
   * The root item for the invalid address.
   */
  Item addressToItem(final ItemAddress address);

  ItemAddress rootAddress();

  ItemAddress stateMachineAddress();

  ItemAddress statesRootAddress();

  ItemAddress transitionsRootAddress();

  /**
   * True for the invalid address and the four fixed anchors.
   */
  boolean isTrivialAddress(final ItemAddress address);

  boolean isStateAddress(final ItemAddress address);

  boolean isInitialStateAddress(final ItemAddress address);

  boolean isTransitionAddress(final ItemAddress address);

  boolean isActionAddress(final ItemAddress address);

  boolean isCommentAddress(final ItemAddress address);

  /**
   * Display text of the address, null where there's nothing to show.
   */
  String data(final ItemAddress address);

  EnumSet<ItemFlag> flags(final ItemAddress address);

  /**
   * Rename the item at an editable address. States and the state machine need a non-empty
   * value, actions accept empty text. Exactly one dataChanged notification is fired on success.
   */
  boolean setData(final ItemAddress address, final String value);

  Optional<Item> idToItem(final String id);


  ///// Reparenting and drag and drop /////
  /**
   * Move a state or initial state, with its subtree, under the states aggregate or under another
   * state. Returns false without any notification if the item already sits under the target.
   * A listener failing while the removal is announced cancels the move. A later listener failure
   * is rethrown once the item sits under the target.
   */
  boolean move(final Item item, final Item targetParent) throws ModelException;

  List<String> mimeTypes();

  EnumSet<DropAction> supportedDropActions();

  /**
   * Build the drag payload for the given selection. Only states and initial states are carried.
   */
  DragPayload mimeData(final List<ItemAddress> addresses);

  /**
   * Move every item of the payload under parent. The whole drop is rejected if any id cannot be
   * resolved to a movable item.
   */
  boolean dropMimeData(final DragPayload payload, final DropAction action, final int row,
      final int column, final ItemAddress parent) throws ModelException;

  /**
   * Textual rendering of the whole tree, one item per line.
   */
  String dump();

  /**
   * A simple builder to let users use fluent APIs to build models.
   */
  public final static class StateMachineModelBuilder {
    private ModelConfiguration config;

    public static StateMachineModelBuilder newBuilder() {
      return new StateMachineModelBuilder();
    }

    public StateMachineModelBuilder config(final ModelConfiguration config) {
      this.config = config;
      return this;
    }

    public StateMachineModel build() {
      return new StateMachineModelImpl(config == null ? ModelConfiguration.defaults() : config);
    }

    private StateMachineModelBuilder() {}
  }

}
