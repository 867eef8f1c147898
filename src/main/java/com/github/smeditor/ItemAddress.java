package com.github.smeditor;

/**
 * Position of an item as seen by a tree view: the row within its parent, the column and the
 * item itself. Addresses are only meaningful until the next reset of the model that issued
 * them.
 */
public final class ItemAddress {
  public static final ItemAddress INVALID = new ItemAddress(-1, -1, null);

  private final int row;
  private final int column;
  private final Item item;

  ItemAddress(final int row, final int column, final Item item) {
    this.row = row;
    this.column = column;
    this.item = item;
  }

  public int getRow() {
    return row;
  }

  public int getColumn() {
    return column;
  }

  /**
   * The referenced item, null for the invalid address.
   */
  public Item getItem() {
    return item;
  }

  public boolean isValid() {
    return item != null && row >= 0 && column >= 0;
  }

  // identity of the item, not its content, decides equality
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ItemAddress)) {
      return false;
    }
    ItemAddress other = (ItemAddress) obj;
    return row == other.row && column == other.column && item == other.item;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + row;
    result = prime * result + column;
    result = prime * result + System.identityHashCode(item);
    return result;
  }

  @Override
  public String toString() {
    return "ItemAddress [row=" + row + ", column=" + column + ", item="
        + (item == null ? null : item.getKind() + ":" + item.getId()) + "]";
  }
}
