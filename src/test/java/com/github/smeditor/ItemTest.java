package com.github.smeditor;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

/**
 * Tests for the ownership and row bookkeeping of the item tree.
 */
public class ItemTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static StateItem state(final String id) {
    return new StateItem(id, id.toUpperCase(), "", Rect.of(0, 0, 10, 10));
  }

  @Test
  public void testRootSkeleton() {
    final RootItem root = new RootItem("Machine");
    assertEquals(1, root.childCount());
    final StateMachineItem machine = root.getStateMachine();
    assertEquals(ItemKind.STATE_MACHINE_ROOT, machine.getKind());
    assertEquals("Machine", machine.getTitle());
    assertEquals(2, machine.childCount());
    assertEquals(ItemKind.STATES_AGGREGATE, machine.child(0).getKind());
    assertEquals(ItemKind.TRANSITIONS_AGGREGATE, machine.child(1).getKind());
    assertEquals(0, machine.child(0).row());
    assertEquals(1, machine.child(1).row());
    assertSame(root, machine.parent());
    assertTrue(root.isRoot());
    assertFalse(machine.isRoot());
  }

  @Test
  public void testRowsFollowChildOrder() {
    final StateItem parent = state("p");
    final StateItem a = state("a");
    final StateItem b = state("b");
    final StateItem c = state("c");
    parent.addChild(a);
    parent.addChild(b);
    parent.addChild(c);
    assertEquals(0, a.row());
    assertEquals(1, b.row());
    assertEquals(2, c.row());
    assertSame(b, parent.child(1));

    assertTrue(parent.removeChild(a));
    assertNull(a.parent());
    assertEquals(2, parent.childCount());
    assertEquals(0, b.row());
    assertEquals(1, c.row());

    parent.insertChild(1, a);
    assertEquals(0, b.row());
    assertEquals(1, a.row());
    assertEquals(2, c.row());
    assertSame(parent, a.parent());
  }

  @Test
  public void testRemoveChildOfAnotherParent() {
    final StateItem parent = state("p");
    final StateItem other = state("o");
    final StateItem child = state("c");
    other.addChild(child);
    assertFalse(parent.removeChild(child));
    assertFalse(parent.removeChild(null));
    assertSame(other, child.parent());
  }

  @Test(expected = IllegalStateException.class)
  public void testAttachedItemCannotBeAddedTwice() {
    final StateItem parent = state("p");
    final StateItem child = state("c");
    parent.addChild(child);
    state("q").addChild(child);
  }

  @Test
  public void testChildOutOfBounds() {
    final StateItem parent = state("p");
    parent.addChild(state("a"));
    assertNull(parent.child(-1));
    assertNull(parent.child(1));
  }

  @Test
  public void testAncestry() {
    final StateItem top = state("top");
    final StateItem middle = state("middle");
    final StateItem leaf = state("leaf");
    top.addChild(middle);
    middle.addChild(leaf);
    assertTrue(top.isAncestorOf(leaf));
    assertTrue(middle.isAncestorOf(leaf));
    assertFalse(leaf.isAncestorOf(top));
    assertFalse(top.isAncestorOf(top));
    assertFalse(top.isAncestorOf(null));
  }

  @Test
  public void testActionIsFirstChild() {
    final StateItem stateWithAction =
        new StateItem("s", "S", "entry/ on()", Rect.of(0, 0, 10, 10));
    assertEquals(1, stateWithAction.childCount());
    assertEquals(ItemKind.ACTION, stateWithAction.child(0).getKind());
    assertEquals("entry/ on()", stateWithAction.getAction());
    assertNull(stateWithAction.child(0).getId());

    final StateItem plain = state("plain");
    assertEquals(0, plain.childCount());
    assertEquals("", plain.getAction());

    stateWithAction.addChild(plain);
    assertEquals(1, plain.row());
  }

  @Test
  public void testTransitionTitleFollowsEndpoints() throws ModelException {
    final StateItem a = state("a");
    final StateItem b = state("b");
    final TransitionItem transition = new TransitionItem("t", a, b, "go",
        new TransitionGeometry(Point.of(0, 0), Point.of(1, 1), null));
    assertEquals("A -> B", transition.getTitle());
    a.rename("Alpha");
    assertEquals("Alpha -> B", transition.getTitle());
    assertEquals("go", transition.getAction());
    assertTrue(transition.getGeometry().getRoutePoints().isEmpty());
  }

  @Test
  public void testTransitionNeedsEndpoints() {
    try {
      new TransitionItem("t", state("a"), null, "", null);
    } catch (ModelException expected) {
      assertEquals(ModelException.Code.UNRESOLVED_ENDPOINT, expected.getCode());
      return;
    }
    throw new AssertionError("Transition without target was accepted");
  }
}
