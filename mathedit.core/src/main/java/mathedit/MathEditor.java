package mathedit;

import mathedit.cursor.Address;
import mathedit.cursor.EditorCursor;
import mathedit.cursor.NodeIndex;
import mathedit.impl.DeleteController;
import mathedit.impl.InsertController;
import mathedit.impl.Literals;
import mathedit.impl.Navigation;
import mathedit.impl.SelectionController;
import mathedit.impl.WrapController;
import mathedit.nodes.Node;
import mathedit.nodes.Nodes;
import mathedit.selection.Clipboard;
import mathedit.selection.ClipboardContent;
import mathedit.selection.LayoutOracle;
import mathedit.selection.LocalClipboard;
import mathedit.selection.Point;
import mathedit.selection.SelectionDragMachine;
import mathedit.selection.SelectionRange;
import mathedit.serializer.ExpressionSerializer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Single-threaded editing engine over one document. Every mutating operation snapshots the document,
 * runs a controller, normalizes literals and, when the tree actually changed, records history, bumps the
 * structure version, notifies listeners and re-evaluates.
 */
public class MathEditor {
  private static final Logger logger = LogManager.getLogger(MathEditor.class);

  public final EditorSettings settings;
  private final Evaluator evaluator;
  private final Clipboard clipboard;
  @Nullable private final SelectionDragMachine dragMachine;
  private final List<EditorListener> listeners = new CopyOnWriteArrayList<>();

  private final Document doc = new Document();
  private History history;
  private NodeIndex index;
  private long structureVersion;
  private String result = "";

  /**
   * Editor configured from the bundled {@value EditorSettings#RESOURCE}.
   */
  public MathEditor() {
    this(EditorSettings.load());
  }

  public MathEditor(EditorSettings settings) {
    this(settings, Evaluator.NONE, new LocalClipboard(), null);
  }

  public MathEditor(EditorSettings settings, Evaluator evaluator, Clipboard clipboard, @Nullable LayoutOracle layout) {
    this.settings = Objects.requireNonNull(settings);
    this.evaluator = Objects.requireNonNull(evaluator);
    this.clipboard = Objects.requireNonNull(clipboard);
    this.dragMachine = layout == null ? null : new SelectionDragMachine(layout, settings);
    this.history = new History(settings.historyLimit);
    this.index = NodeIndex.build(doc.expression);
  }

  public void addListener(EditorListener listener) {
    listeners.add(Objects.requireNonNull(listener));
  }

  public void removeListener(EditorListener listener) {
    listeners.remove(listener);
  }

  // state

  public List<Node> expression() {
    return Collections.unmodifiableList(doc.expression);
  }

  public EditorCursor cursor() {
    return doc.cursor;
  }

  @Nullable
  public SelectionRange selection() {
    return doc.selection;
  }

  public boolean hasSelection() {
    return doc.hasSelection();
  }

  public long structureVersion() {
    return structureVersion;
  }

  public String result() {
    return result;
  }

  public NodeIndex nodeIndex() {
    return index;
  }

  public History history() {
    return history;
  }

  public List<History.Entry> operationLog() {
    return history.entries();
  }

  public boolean canUndo() {
    return history.canUndo();
  }

  public boolean canRedo() {
    return history.canRedo();
  }

  // input

  public boolean insertCharacter(@NotNull String ch) {
    return edit(Op.INSERT_CHARACTER, d -> InsertController.insertCharacter(d, settings, ch));
  }

  public boolean insertConstant(@NotNull String symbol) {
    return edit(Op.INSERT_CONSTANT, d -> InsertController.insertConstant(d, symbol));
  }

  public boolean insertUnitVector(@NotNull String axis) {
    return edit(Op.INSERT_UNIT_VECTOR, d -> InsertController.insertUnitVector(d, axis));
  }

  public boolean wrapIntoFraction() {
    return edit(Op.WRAP_FRACTION, WrapController::wrapIntoFraction);
  }

  public boolean wrapIntoExponent() {
    return edit(Op.WRAP_EXPONENT, WrapController::wrapIntoExponent);
  }

  public boolean wrapIntoSquareRoot() {
    return edit(Op.WRAP_SQUARE_ROOT, InsertController::insertSquareRoot);
  }

  public boolean wrapIntoNthRoot() {
    return edit(Op.WRAP_NTH_ROOT, InsertController::insertNthRoot);
  }

  public boolean wrapIntoLog10() {
    return edit(Op.WRAP_LOG10, InsertController::insertLog10);
  }

  public boolean wrapIntoLogN() {
    return edit(Op.WRAP_LOG_N, InsertController::insertLogN);
  }

  public boolean wrapIntoNaturalLog() {
    return edit(Op.WRAP_NATURAL_LOG, InsertController::insertNaturalLog);
  }

  public boolean wrapIntoTrig(@NotNull String function) {
    return edit(Op.WRAP_TRIG, d -> InsertController.insertTrig(d, function));
  }

  public boolean wrapIntoPermutation() {
    return edit(Op.WRAP_PERMUTATION, WrapController::wrapIntoPermutation);
  }

  public boolean wrapIntoCombination() {
    return edit(Op.WRAP_COMBINATION, WrapController::wrapIntoCombination);
  }

  public boolean wrapIntoParenthesis() {
    return edit(Op.WRAP_PARENTHESIS, InsertController::insertParenthesis);
  }

  public boolean insertSquare() {
    return edit(Op.INSERT_SQUARE, WrapController::insertSquare);
  }

  public boolean insertSummation() {
    return edit(Op.INSERT_SUMMATION, d -> InsertController.insertSummation(d, settings));
  }

  public boolean insertProduct() {
    return edit(Op.INSERT_PRODUCT, d -> InsertController.insertProduct(d, settings));
  }

  public boolean insertDerivative() {
    return edit(Op.INSERT_DERIVATIVE, d -> InsertController.insertDerivative(d, settings));
  }

  public boolean insertIntegral() {
    return edit(Op.INSERT_INTEGRAL, d -> InsertController.insertIntegral(d, settings));
  }

  public boolean insertAns() {
    return edit(Op.INSERT_ANS, InsertController::insertAns);
  }

  public boolean insertNewline() {
    return edit(Op.INSERT_NEWLINE, InsertController::insertNewline);
  }

  public boolean deleteChar() {
    return edit(Op.DELETE_CHAR, DeleteController::deleteChar);
  }

  public boolean deleteSelection() {
    return edit(Op.DELETE_SELECTION, SelectionController::deleteSelection);
  }

  /**
   * Resets the document to one empty literal; undoable.
   */
  public boolean clear() {
    return edit(Op.CLEAR, d -> {
      if (d.expression.size() == 1 && Nodes.isEffectivelyEmpty(d.expression)) {
        d.cursor = EditorCursor.ROOT;
        d.selection = null;
        return false;
      }
      d.expression = Nodes.list(Nodes.literal());
      d.cursor = EditorCursor.ROOT;
      d.selection = null;
      return true;
    });
  }

  /**
   * Loads a tree, e.g. a persisted cell, with the cursor at its end. Not recorded in history.
   */
  public void setExpression(List<Node> nodes) {
    doc.expression = nodes.isEmpty() ? Nodes.list(Nodes.literal()) : new ArrayList<>(nodes);
    doc.selection = null;
    doc.cursor = EditorCursor.ROOT;
    Literals.normalize(doc);
    doc.cursor = Navigation.endOfRoot(doc.expression);
    structureChanged(Op.SET_EXPRESSION);
    notifyCursor();
    notifySelection();
  }

  public void clearHistory() {
    history = new History(settings.historyLimit);
  }

  // clipboard

  public boolean copy() {
    ClipboardContent content = SelectionController.copy(doc);
    if (content == null) return false;
    clipboard.set(content);
    return true;
  }

  public boolean cut() {
    if (!copy()) return false;
    return edit(Op.CUT, SelectionController::deleteSelection);
  }

  public boolean paste() {
    ClipboardContent content = clipboard.get();
    return edit(Op.PASTE, d -> SelectionController.paste(d, content));
  }

  // navigation

  public boolean moveLeft() {
    return move(Navigation::moveLeft);
  }

  public boolean moveRight() {
    return move(Navigation::moveRight);
  }

  public boolean moveCursorToStart() {
    return move(Navigation::moveToStart);
  }

  public boolean moveCursorToEnd() {
    return move(Navigation::moveToEnd);
  }

  /**
   * Places the cursor where the rendering layer resolved a tap.
   */
  public boolean navigateTo(EditorCursor cursor) {
    if (!Address.isValid(doc.expression, cursor)) {
      logger.debug("Ignoring unresolvable cursor {}", cursor);
      return false;
    }
    return move(d -> {
      d.cursor = cursor;
      return true;
    });
  }

  // selection

  public boolean setSelection(@Nullable SelectionRange selection) {
    if (selection != null && Address.resolveSiblingList(doc.expression, selection.parentId(), selection.slot()) == null) {
      logger.debug("Ignoring selection in unknown context {}", selection);
      return false;
    }
    SelectionRange before = doc.selection;
    doc.selection = selection;
    if (!Objects.equals(before, selection)) {
      notifySelection();
    }
    return true;
  }

  public void selectAll() {
    setSelection(SelectionController.selectAll(doc));
  }

  public void clearSelection() {
    setSelection(null);
  }

  public void startDrag(boolean isStartHandle) {
    drag(machine -> machine.startDrag(doc, isStartHandle));
  }

  public void updateDrag(Point point) {
    drag(machine -> machine.updateDrag(doc, index, point));
  }

  public void endDrag() {
    drag(SelectionDragMachine::endDrag);
  }

  public void selectAtPosition(Point point) {
    drag(machine -> machine.selectAtPosition(doc, index, point));
  }

  private void drag(Consumer<SelectionDragMachine> action) {
    if (dragMachine == null) {
      logger.debug("No layout oracle, ignoring drag");
      return;
    }
    SelectionRange before = doc.selection;
    action.accept(dragMachine);
    if (!Objects.equals(before, doc.selection)) {
      notifySelection();
    }
  }

  // history

  public boolean undo() {
    if (!history.canUndo()) return false;
    EditorState target = history.lastUndo();
    history = history.undo(EditorState.capture(doc.expression, doc.cursor));
    restore(target, Op.UNDO);
    return true;
  }

  public boolean redo() {
    if (!history.canRedo()) return false;
    EditorState target = history.lastRedo();
    history = history.redo(EditorState.capture(doc.expression, doc.cursor));
    restore(target, Op.REDO);
    return true;
  }

  private void restore(EditorState state, Op op) {
    logger.trace("{} to {}", op, state);
    doc.expression = state.expression;
    doc.cursor = state.cursor;
    doc.selection = null;
    ensureValidCursor();
    structureChanged(op);
    notifyCursor();
    notifySelection();
  }

  // queries

  public String getExpression() {
    return ExpressionSerializer.serialize(doc.expression);
  }

  public Set<String> getVariables() {
    return ExpressionSerializer.extractVariables(doc.expression);
  }

  public boolean isEquation() {
    return ExpressionSerializer.isEquation(doc.expression);
  }

  @Nullable
  public String[] splitEquation() {
    return ExpressionSerializer.splitEquation(doc.expression);
  }

  // plumbing

  private boolean edit(Op op, Predicate<Document> action) {
    EditorState before = EditorState.capture(doc.expression, doc.cursor);
    EditorCursor cursorBefore = doc.cursor;
    SelectionRange selectionBefore = doc.selection;

    boolean applied = action.test(doc);
    Literals.normalize(doc);
    ensureValidCursor();

    // a paste over an equal copy keeps the shape but brings new identities
    boolean changed = !Nodes.sameShape(before.expression, doc.expression) ||
                      !NodeIndex.build(doc.expression).sameNodes(index);
    if (changed) {
      logger.trace("Recording {}", before);
      history = history.record(before);
      structureChanged(op);
    }
    else {
      logger.debug("{} left the tree unchanged", op);
    }
    if (!doc.cursor.equals(cursorBefore)) {
      notifyCursor();
    }
    if (!Objects.equals(selectionBefore, doc.selection)) {
      notifySelection();
    }
    return applied;
  }

  private boolean move(Predicate<Document> action) {
    EditorCursor before = doc.cursor;
    int size = countNodes(doc.expression);
    boolean moved = action.test(doc);
    if (doc.selection != null) {
      doc.selection = null;
      notifySelection();
    }
    if (countNodes(doc.expression) != size) {
      // a spacer literal was added next to a symbol
      index = NodeIndex.build(doc.expression);
      structureVersion++;
      for (EditorListener listener : listeners) {
        listener.structureChanged(structureVersion);
      }
    }
    if (!doc.cursor.equals(before)) {
      notifyCursor();
    }
    return moved;
  }

  private void structureChanged(Op op) {
    index = NodeIndex.build(doc.expression);
    structureVersion++;
    history = history.log(op, structureVersion);
    logger.debug("{} -> version {}", op, structureVersion);
    for (EditorListener listener : listeners) {
      listener.structureChanged(structureVersion);
    }
    recompute();
  }

  private void recompute() {
    String serialized = ExpressionSerializer.serialize(doc.expression);
    String next;
    try {
      next = evaluator.recompute(serialized);
      if (next == null) next = "";
    }
    catch (RuntimeException e) {
      logger.warn("Evaluation of '{}' failed", serialized, e);
      next = "";
    }
    result = next;
    for (EditorListener listener : listeners) {
      listener.resultChanged(result);
    }
  }

  private void ensureValidCursor() {
    if (!Address.isValid(doc.expression, doc.cursor)) {
      logger.debug("Cursor {} no longer resolves, moving to end", doc.cursor);
      doc.cursor = Navigation.endOfRoot(doc.expression);
    }
    if (doc.selection != null && Address.resolveSiblingList(doc.expression, doc.selection.parentId(), doc.selection.slot()) == null) {
      doc.selection = null;
    }
  }

  private void notifyCursor() {
    for (EditorListener listener : listeners) {
      listener.cursorChanged(doc.cursor);
    }
  }

  private void notifySelection() {
    for (EditorListener listener : listeners) {
      listener.selectionChanged(doc.selection);
    }
  }

  private static int countNodes(List<Node> nodes) {
    int count = nodes.size();
    for (Node node : nodes) {
      for (String slot : node.slotNames()) {
        count += countNodes(node.slot(slot));
      }
    }
    return count;
  }
}
