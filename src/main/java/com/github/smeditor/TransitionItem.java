package com.github.smeditor;

/**
 * A transition between two states. Transitions always sit directly under the transitions
 * aggregate, whatever the nesting of their endpoints.
 *
 * The source and target are references into the states subtree; the transition does not own
 * them and they may be moved around independently of it.
 */
public final class TransitionItem extends Item {
  private final Item source;
  private final Item target;
  private final TransitionGeometry geometry;

  TransitionItem(final String id, final Item source, final Item target, final String action,
      final TransitionGeometry geometry) throws ModelException {
    super(ItemKind.TRANSITION, id);
    if (source == null || target == null) {
      throw new ModelException(ModelException.Code.UNRESOLVED_ENDPOINT,
          "Transition " + id + " needs both a source and a target");
    }
    this.source = source;
    this.target = target;
    this.geometry = geometry;
    attachAction(action);
  }

  public Item getSource() {
    return source;
  }

  public Item getTarget() {
    return target;
  }

  public TransitionGeometry getGeometry() {
    return geometry;
  }

  /**
   * Trimmed behavior text, empty when the transition has none.
   */
  public String getAction() {
    return actionText();
  }

  @Override
  public String getTitle() {
    return source.getTitle() + " -> " + target.getTitle();
  }
}
