package com.github.smeditor;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Registry of all addressable items of one model, keyed by id. It is owned by the model and
 * cleared together with the tree on every reset; between resets it only grows.
 *
 * The registry never owns the items it points to, the tree does.
 */
final class ItemRegistry {
  private static final Logger logger = LogManager.getLogger(ItemRegistry.class.getSimpleName());

  // K=effective item id, V=item in the tree
  private final Map<String, Item> itemsById = new HashMap<>();

  // every id handed out by generateId() since the last clear, registered or not
  private final Set<String> generatedIds = new HashSet<>();
  private long generatedIdCounter;

  // ids read from the graph being imported, never handed out by generateId()
  private final Set<String> reservedIds = new HashSet<>();

  private final String collisionSuffix;
  private final String generatedIdPrefix;

  ItemRegistry(final String collisionSuffix, final String generatedIdPrefix) {
    this.collisionSuffix = collisionSuffix;
    this.generatedIdPrefix = generatedIdPrefix;
  }

  /**
   * Produces an id that is neither registered, reserved nor previously generated.
   */
  String generateId() {
    String id;
    do {
      id = generatedIdPrefix + (++generatedIdCounter);
    } while (itemsById.containsKey(id) || reservedIds.contains(id)
        || generatedIds.contains(id));
    generatedIds.add(id);
    return id;
  }

  /**
   * Registers the item under the given id, appending the collision suffix as many times as
   * needed to find a free slot. The item's id is updated to the effective id, which is also
   * returned so that callers can tell whether it changed.
   */
  String register(final String id, final Item item) throws ModelException {
    if (id == null || id.isEmpty()) {
      throw new ModelException(ModelException.Code.INVALID_ID,
          "Cannot register " + item + " without an id");
    }
    if (!item.getKind().isAddressable()) {
      throw new ModelException(ModelException.Code.INVALID_ID,
          "Cannot register " + item + ", its kind has no id");
    }
    String effectiveId = id;
    while (itemsById.containsKey(effectiveId)) {
      effectiveId += collisionSuffix;
    }
    if (!effectiveId.equals(id)) {
      logger.warn(String.format("Id %s is already taken, registering %s as %s", id, item,
          effectiveId));
    }
    itemsById.put(effectiveId, item);
    item.setId(effectiveId);
    return effectiveId;
  }

  /**
   * Registers the item under a freshly generated id.
   */
  String registerGenerated(final Item item) {
    final String id = generateId();
    itemsById.put(id, item);
    item.setId(id);
    return id;
  }

  /**
   * Keeps the given id out of reach of {@link #generateId()} until the next clear. Registering
   * it explicitly is still allowed.
   */
  void reserve(final String id) {
    if (id != null && !id.isEmpty()) {
      reservedIds.add(id);
    }
  }

  Optional<Item> resolve(final String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(itemsById.get(id));
  }

  boolean contains(final String id) {
    return id != null && itemsById.containsKey(id);
  }

  int size() {
    return itemsById.size();
  }

  void clear() {
    if (logger.isDebugEnabled()) {
      logger.debug("Clearing registry of " + itemsById.size() + " items");
    }
    itemsById.clear();
    generatedIds.clear();
    reservedIds.clear();
    generatedIdCounter = 0L;
  }

  @Override
  public String toString() {
    return "ItemRegistry [registered=" + itemsById.size() + ", generated=" + generatedIds.size()
        + ", reserved=" + reservedIds.size() + "]";
  }
}
