package cafe.woden.chatwindow.model;

/**
 * Something that occupies a position in a single total order and is identified by a serial.
 *
 * <p>{@link #before(Sequenced)} and {@link #after(Sequenced)} must agree with each other: for any
 * two items with different serials exactly one of them holds, and neither holds for equal serials.
 */
public interface Sequenced {

  String serial();

  boolean before(Sequenced other);

  boolean after(Sequenced other);
}
