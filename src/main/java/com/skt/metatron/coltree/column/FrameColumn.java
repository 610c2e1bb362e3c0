package com.skt.metatron.coltree.column;

import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.type.ColumnType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Named column whose cells are independent frames. A cell may be null.
 */
public class FrameColumn extends Column {
  private final List<DataFrame> frames;

  public FrameColumn(String name, List<DataFrame> frames) {
    super(name);
    this.frames = Collections.unmodifiableList(new ArrayList<>(frames));
  }

  /**
   * Cuts {@code source} into consecutive frames. Frame {@code i} holds the rows from
   * {@code startIndices[i]} up to the next start index, or up to the end of {@code source}.
   */
  public static FrameColumn create(String name, DataFrame source, List<Integer> startIndices) {
    List<DataFrame> frames = new ArrayList<>(startIndices.size());
    for (int i = 0; i < startIndices.size(); i++) {
      int from = startIndices.get(i);
      int to = i + 1 < startIndices.size() ? startIndices.get(i + 1) : source.nrow();
      frames.add(source.getRows(from, to));
    }
    return new FrameColumn(name, frames);
  }

  public List<DataFrame> frames() {
    return frames;
  }

  @Override
  public ColumnKind kind() {
    return ColumnKind.FRAME;
  }

  @Override
  public ColumnType type() {
    return ColumnType.FRAME.withNullable(frames.contains(null));
  }

  @Override
  public int size() {
    return frames.size();
  }

  @Override
  public DataFrame get(int rowno) {
    return frames.get(rowno);
  }

  @Override
  public List<Object> values() {
    return new ArrayList<Object>(frames);
  }

  @Override
  public FrameColumn rename(String newName) {
    return new FrameColumn(newName, frames);
  }

  public FrameColumn withFrames(List<DataFrame> newFrames) {
    return new FrameColumn(name, newFrames);
  }

  @Override
  public FrameColumn slice(List<Integer> rownos) {
    List<DataFrame> newFrames = new ArrayList<>(rownos.size());
    for (int rowno : rownos) {
      newFrames.add(frames.get(rowno));
    }
    return new FrameColumn(name, newFrames);
  }
}
