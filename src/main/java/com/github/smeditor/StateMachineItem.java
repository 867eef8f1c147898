package com.github.smeditor;

/**
 * The state machine itself. Its title is the machine's display name.
 */
public final class StateMachineItem extends Item {
  private String name;

  StateMachineItem(final String name) {
    super(ItemKind.STATE_MACHINE_ROOT, null);
    this.name = name;
  }

  void rename(final String name) {
    this.name = name;
  }

  @Override
  public String getTitle() {
    return name;
  }
}
