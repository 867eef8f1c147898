package com.github.smeditor;

/**
 * Invisible root of the editor tree. Creating one also creates the fixed skeleton below it:
 * the state machine item with its states aggregate at row 0 and transitions aggregate at row 1.
 */
final class RootItem extends Item {

  RootItem(final String machineName) {
    super(ItemKind.ROOT, null);
    final StateMachineItem machine = new StateMachineItem(machineName);
    machine.addChild(new AggregateItem(ItemKind.STATES_AGGREGATE, "States"));
    machine.addChild(new AggregateItem(ItemKind.TRANSITIONS_AGGREGATE, "Transitions"));
    addChild(machine);
  }

  StateMachineItem getStateMachine() {
    return (StateMachineItem) child(0);
  }

  @Override
  public String getTitle() {
    return "";
  }
}
