package com.github.smeditor;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.smeditor.ModelException.Code;

/**
 * Drag and drop payload: the ordered ids of the dragged states, tagged with the model's single
 * payload type. Items themselves never travel, the receiving side resolves the ids again.
 *
 * The wire form is an int count followed by one modified-UTF-8 string per id, as written by
 * {@link DataOutputStream}.
 */
public final class DragPayload {
  public static final String STATE_MIME_TYPE = "application/x-smeditor-state";

  private final String mimeType;
  private final List<String> ids;

  public DragPayload(final String mimeType, final List<String> ids) {
    this.mimeType = mimeType;
    this.ids = ids == null ? Collections.<String>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(ids));
  }

  public static DragPayload ofStates(final List<String> ids) {
    return new DragPayload(STATE_MIME_TYPE, ids);
  }

  public String getMimeType() {
    return mimeType;
  }

  public List<String> getIds() {
    return ids;
  }

  public boolean hasFormat(final String format) {
    return mimeType != null && mimeType.equals(format);
  }

  public byte[] encode() throws ModelException {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (DataOutputStream stream = new DataOutputStream(bytes)) {
      stream.writeInt(ids.size());
      for (final String id : ids) {
        stream.writeUTF(id);
      }
    } catch (IOException exception) {
      throw new ModelException(Code.INVALID_PAYLOAD, exception);
    }
    return bytes.toByteArray();
  }

  public static DragPayload decode(final String mimeType, final byte[] data)
      throws ModelException {
    if (!STATE_MIME_TYPE.equals(mimeType)) {
      throw new ModelException(Code.INVALID_PAYLOAD, "Unsupported payload type " + mimeType);
    }
    if (data == null) {
      throw new ModelException(Code.INVALID_PAYLOAD, "No payload data");
    }
    try (DataInputStream stream = new DataInputStream(new ByteArrayInputStream(data))) {
      final int count = stream.readInt();
      if (count < 0) {
        throw new ModelException(Code.INVALID_PAYLOAD, "Negative id count " + count);
      }
      final List<String> ids = new ArrayList<>();
      for (int iter = 0; iter < count; iter++) {
        ids.add(stream.readUTF());
      }
      if (stream.available() > 0) {
        throw new ModelException(Code.INVALID_PAYLOAD,
            stream.available() + " trailing bytes after " + count + " ids");
      }
      return new DragPayload(mimeType, ids);
    } catch (IOException exception) {
      throw new ModelException(Code.INVALID_PAYLOAD, exception);
    }
  }

  @Override
  public String toString() {
    return "DragPayload [mimeType=" + mimeType + ", ids=" + ids + "]";
  }
}
