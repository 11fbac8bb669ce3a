package scribe;

/**
 * An editor command bound to a key. Commands that leave the text alone return {@link Change#none()}.
 */
@FunctionalInterface
public interface Command {
  Change apply(Editor editor);
}
