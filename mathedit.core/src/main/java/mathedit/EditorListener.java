package mathedit;

import mathedit.cursor.EditorCursor;
import mathedit.selection.SelectionRange;
import org.jetbrains.annotations.Nullable;

public interface EditorListener {
  default void structureChanged(long version) {
  }

  default void cursorChanged(EditorCursor cursor) {
  }

  default void selectionChanged(@Nullable SelectionRange selection) {
  }

  default void resultChanged(String result) {
  }
}
