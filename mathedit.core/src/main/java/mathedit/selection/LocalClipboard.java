package mathedit.selection;

import org.jetbrains.annotations.Nullable;

public class LocalClipboard implements Clipboard {
  private ClipboardContent content;

  @Nullable
  @Override
  public ClipboardContent get() {
    return content;
  }

  @Override
  public void set(@Nullable ClipboardContent content) {
    this.content = content;
  }
}
