package com.github.smeditor;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;

import org.junit.Test;

/**
 * Tests to maintain the sanity and correctness of moves, drag and drop and the notification
 * brackets around them.
 */
public class ModelMutationTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testMoveToStatesRoot() throws Exception {
    final StateMachineModel model = SampleGraphs.loadedModel(SampleGraphs.blinker());
    final RecordingListener listener = new RecordingListener();
    model.addListener(listener);
    final Item running = model.idToItem("running").get();
    final Item states = model.statesRootAddress().getItem();

    assertTrue(model.move(running, states));
    assertEquals(Arrays.asList("aboutToRemove active 0-0", "removed active 0-0",
        "aboutToInsert STATES_AGGREGATE 4-4", "inserted STATES_AGGREGATE 4-4"), listener.events);
    assertSame(states, running.parent());
    assertEquals(4, running.row());
    assertEquals(1, model.idToItem("active").get().childCount());
    // the transition still points at the moved state
    assertEquals("Running -> <Untitled>", model.idToItem("e-pause").get().getTitle());
  }

  @Test
  public void testMoveIntoLaterSibling() throws Exception {
    final StateMachineModel model = SampleGraphs.loadedModel(SampleGraphs.blinker());
    final RecordingListener listener = new RecordingListener();
    model.addListener(listener);
    final Item idle = model.idToItem("idle").get();
    final Item active = model.idToItem("active").get();

    assertTrue(model.move(idle, active));
    // active moved up one row once idle was gone
    assertEquals(Arrays.asList("aboutToRemove STATES_AGGREGATE 1-1",
        "removed STATES_AGGREGATE 1-1", "aboutToInsert active 2-2", "inserted active 2-2"),
        listener.events);
    assertEquals(1, active.row());
    assertEquals(new ItemAddress(2, 0, idle), model.itemToAddress(idle));
    assertEquals(model.itemToAddress(active), model.parent(model.itemToAddress(idle)));
  }

  @Test
  public void testMoveOntoCurrentParentIsNoop() throws Exception {
    final StateMachineModel model = SampleGraphs.loadedModel(SampleGraphs.blinker());
    final RecordingListener listener = new RecordingListener();
    model.addListener(listener);
    final Item running = model.idToItem("running").get();

    assertFalse(model.move(running, model.idToItem("active").get()));
    assertTrue(listener.events.isEmpty());
    assertEquals(0, running.row());
  }

  @Test
  public void testInvalidMoves() {
    final StateMachineModel model = SampleGraphs.loadedModel(SampleGraphs.blinker());
    final RecordingListener listener = new RecordingListener();
    model.addListener(listener);
    final Item active = model.idToItem("active").get();
    final Item running = model.idToItem("running").get();
    final Item comment = model.index(3, 0, model.statesRootAddress()).getItem();
    final Item transition = model.idToItem("e-go").get();

    assertMoveRejected(model, active, running);
    assertMoveRejected(model, active, active);
    assertMoveRejected(model, comment, active);
    assertMoveRejected(model, transition, active);
    assertMoveRejected(model, running, model.transitionsRootAddress().getItem());
    assertMoveRejected(model, running, model.idToItem("init").get());
    assertMoveRejected(model, null, active);

    final StateMachineModel other = SampleGraphs.loadedModel(SampleGraphs.blinker());
    assertMoveRejected(model, other.idToItem("idle").get(), active);

    assertTrue(listener.events.isEmpty());
    assertSame(active, running.parent());
  }

  private static void assertMoveRejected(final StateMachineModel model, final Item item,
      final Item target) {
    try {
      model.move(item, target);
      fail("Expected move of " + item + " under " + target + " to be rejected");
    } catch (ModelException expected) {
      assertEquals(ModelException.Code.INVALID_MOVE, expected.getCode());
    }
  }

  @Test
  public void testMimeDataCarriesOnlyStates() {
    final StateMachineModel model = SampleGraphs.loadedModel(SampleGraphs.blinker());
    final DragPayload payload = model.mimeData(Arrays.asList(
        model.itemToAddress(model.idToItem("idle").get()),
        model.itemToAddress(model.idToItem("e-go").get()),
        model.itemToAddress(model.idToItem("init").get()),
        model.statesRootAddress(), ItemAddress.INVALID));

    assertTrue(payload.hasFormat(DragPayload.STATE_MIME_TYPE));
    assertEquals(Arrays.asList("idle", "init"), payload.getIds());
    assertEquals(Collections.singletonList(DragPayload.STATE_MIME_TYPE), model.mimeTypes());
    assertEquals(EnumSet.of(DropAction.MOVE), model.supportedDropActions());
  }

  @Test
  public void testDropMovesEveryItem() throws Exception {
    final StateMachineModel model = SampleGraphs.loadedModel(SampleGraphs.blinker());
    final Item active = model.idToItem("active").get();
    final ItemAddress target = model.itemToAddress(active);
    final byte[] bytes = model.mimeData(Arrays.asList(
        model.itemToAddress(model.idToItem("init").get()),
        model.itemToAddress(model.idToItem("idle").get()))).encode();
    final RecordingListener listener = new RecordingListener();
    model.addListener(listener);

    final DragPayload payload = DragPayload.decode(DragPayload.STATE_MIME_TYPE, bytes);
    assertTrue(model.dropMimeData(payload, DropAction.MOVE, -1, 0, target));

    assertSame(active, model.idToItem("init").get().parent());
    assertSame(active, model.idToItem("idle").get().parent());
    assertEquals(4, active.childCount());
    assertEquals(8, listener.events.size());
    assertEquals("aboutToRemove STATES_AGGREGATE 0-0", listener.events.get(0));
    assertEquals("inserted active 3-3", listener.events.get(7));
  }

  @Test
  public void testDropOntoStatesRoot() throws Exception {
    final StateMachineModel model = SampleGraphs.loadedModel(SampleGraphs.blinker());
    final DragPayload payload = DragPayload.ofStates(Arrays.asList("paused", "idle"));

    assertTrue(model.dropMimeData(payload, DropAction.MOVE, 0, 0, model.statesRootAddress()));
    final Item states = model.statesRootAddress().getItem();
    assertSame(states, model.idToItem("paused").get().parent());
    // idle was already there and stays in place
    assertEquals(1, model.idToItem("idle").get().row());
    assertEquals(4, model.idToItem("paused").get().row());
  }

  @Test
  public void testRejectedDropsLeaveTreeUntouched() throws Exception {
    final StateMachineModel model = SampleGraphs.loadedModel(SampleGraphs.blinker());
    final String before = model.dump();
    final RecordingListener listener = new RecordingListener();
    model.addListener(listener);
    final ItemAddress active = model.itemToAddress(model.idToItem("active").get());
    final ItemAddress running = model.itemToAddress(model.idToItem("running").get());

    // one unknown id rejects the whole drop
    assertFalse(model.dropMimeData(DragPayload.ofStates(Arrays.asList("idle", "ghost")),
        DropAction.MOVE, 0, 0, active));
    // a state cannot go below itself
    assertFalse(model.dropMimeData(DragPayload.ofStates(Arrays.asList("idle", "active")),
        DropAction.MOVE, 0, 0, running));
    // transitions are not draggable even when named explicitly
    assertFalse(model.dropMimeData(DragPayload.ofStates(Collections.singletonList("e-go")),
        DropAction.MOVE, 0, 0, active));
    assertFalse(model.dropMimeData(DragPayload.ofStates(Collections.singletonList("idle")),
        DropAction.MOVE, 0, 0, model.transitionsRootAddress()));
    assertFalse(model.dropMimeData(DragPayload.ofStates(Collections.singletonList("idle")),
        DropAction.COPY, 0, 0, active));
    assertFalse(model.dropMimeData(DragPayload.ofStates(Collections.singletonList("idle")),
        DropAction.MOVE, 0, 1, active));
    assertFalse(model.dropMimeData(new DragPayload("text/plain", Arrays.asList("idle")),
        DropAction.MOVE, 0, 0, active));
    assertFalse(model.dropMimeData(DragPayload.ofStates(Collections.singletonList("idle")),
        DropAction.MOVE, 0, 0, ItemAddress.INVALID));

    assertTrue(listener.events.isEmpty());
    assertEquals(before, model.dump());
  }

  @Test
  public void testIgnoreDropIsAccepted() throws Exception {
    final StateMachineModel model = SampleGraphs.loadedModel(SampleGraphs.blinker());
    final RecordingListener listener = new RecordingListener();
    model.addListener(listener);
    assertTrue(model.dropMimeData(DragPayload.ofStates(Collections.singletonList("idle")),
        DropAction.IGNORE, 0, 0, model.itemToAddress(model.idToItem("active").get())));
    assertTrue(listener.events.isEmpty());
    assertSame(model.statesRootAddress().getItem(), model.idToItem("idle").get().parent());
  }

  @Test
  public void testStructuralChangesDoNotNest() {
    final ChangeNotifier notifier = new ChangeNotifier();
    final RecordingListener listener = new RecordingListener();
    notifier.addListener(listener);
    try (StructuralChange outer = StructuralChange.reset(notifier)) {
      assertTrue(notifier.inStructuralChange());
      try (StructuralChange inner =
          StructuralChange.insertRows(notifier, ItemAddress.INVALID, 0, 0)) {
        fail("Nested change " + inner + " should not open");
      } catch (IllegalStateException expected) {
      }
    }
    assertFalse(notifier.inStructuralChange());
    assertEquals(Arrays.asList("aboutToReset", "reset"), listener.events);
  }

  @Test
  public void testRemovedListenerHearsNothing() throws Exception {
    final StateMachineModel model = SampleGraphs.loadedModel(SampleGraphs.blinker());
    final RecordingListener listener = new RecordingListener();
    model.addListener(listener);
    model.removeListener(listener);
    model.move(model.idToItem("idle").get(), model.idToItem("active").get());
    model.reset();
    assertTrue(listener.events.isEmpty());
  }

  private static final class FailingListener implements ItemModelListener {
    private final String failOn;

    private FailingListener(final String failOn) {
      this.failOn = failOn;
    }

    private void maybeFail(final String event) {
      if (failOn.equals(event)) {
        throw new IllegalStateException("listener refused " + event);
      }
    }

    @Override
    public void modelAboutToBeReset() {
      maybeFail("aboutToReset");
    }

    @Override
    public void rowsAboutToBeRemoved(final ItemAddress parent, final int first, final int last) {
      maybeFail("aboutToRemove");
    }

    @Override
    public void rowsRemoved(final ItemAddress parent, final int first, final int last) {
      maybeFail("removed");
    }
  }

  @Test
  public void testListenerRefusingRemovalCancelsMove() throws Exception {
    final StateMachineModel model = SampleGraphs.loadedModel(SampleGraphs.blinker());
    final RecordingListener listener = new RecordingListener();
    final FailingListener failing = new FailingListener("aboutToRemove");
    model.addListener(listener);
    model.addListener(failing);
    final Item idle = model.idToItem("idle").get();
    final Item states = model.statesRootAddress().getItem();

    try {
      model.move(idle, model.idToItem("active").get());
      fail("Expected the listener failure to surface");
    } catch (IllegalStateException expected) {
      assertEquals("listener refused aboutToRemove", expected.getMessage());
    }
    assertSame(states, idle.parent());
    assertEquals(1, idle.row());
    assertEquals(Collections.singletonList("aboutToRemove STATES_AGGREGATE 1-1"),
        listener.events);

    // the model is still usable
    model.removeListener(failing);
    listener.events.clear();
    model.reset();
    assertEquals(Arrays.asList("aboutToReset", "reset"), listener.events);
  }

  @Test
  public void testListenerFailingAfterRemovalKeepsItemAttached() throws Exception {
    final StateMachineModel model = SampleGraphs.loadedModel(SampleGraphs.blinker());
    final RecordingListener listener = new RecordingListener();
    final FailingListener failing = new FailingListener("removed");
    model.addListener(listener);
    model.addListener(failing);
    final Item idle = model.idToItem("idle").get();
    final Item active = model.idToItem("active").get();

    try {
      model.move(idle, active);
      fail("Expected the listener failure to surface");
    } catch (IllegalStateException expected) {
      assertEquals("listener refused removed", expected.getMessage());
    }
    // the move is completed and announced, the failure is only reported
    assertSame(active, idle.parent());
    assertEquals(3, active.childCount());
    assertSame(idle, model.idToItem("idle").get());
    assertTrue(model.itemToAddress(idle).isValid());
    assertEquals(Arrays.asList("aboutToRemove STATES_AGGREGATE 1-1",
        "removed STATES_AGGREGATE 1-1", "aboutToInsert active 2-2", "inserted active 2-2"),
        listener.events);

    model.removeListener(failing);
    assertTrue(model.move(idle, model.statesRootAddress().getItem()));
  }

  @Test
  public void testFailedResetAnnouncementDoesNotWedgeNotifier() {
    final ChangeNotifier notifier = new ChangeNotifier();
    notifier.addListener(new FailingListener("aboutToReset"));
    try (StructuralChange change = StructuralChange.reset(notifier)) {
      fail("Reset should not have opened");
    } catch (IllegalStateException expected) {
      assertEquals("listener refused aboutToReset", expected.getMessage());
    }
    assertFalse(notifier.inStructuralChange());

    final RecordingListener listener = new RecordingListener();
    notifier.addListener(listener);
    try (StructuralChange change =
        StructuralChange.insertRows(notifier, ItemAddress.INVALID, 0, 0)) {
      assertTrue(notifier.inStructuralChange());
    }
    assertEquals(Arrays.asList("aboutToInsert <invalid> 0-0", "inserted <invalid> 0-0"),
        listener.events);
  }
}
