package mathedit.selection;

import org.jetbrains.annotations.Nullable;

/**
 * Clipboard service shared by the editors that should see each other's copies.
 */
public interface Clipboard {
  @Nullable
  ClipboardContent get();

  void set(@Nullable ClipboardContent content);
}
