package cadence.live;

/**
 * A live duplex connection to one client.
 *
 * <p>The transport that accepted the connection owns it; {@link ConnectionRegistry} only
 * holds a reference and never closes it. Implementations should define {@code equals} so
 * that re-registering the same underlying connection is recognised.
 */
public interface LiveConnection {

    /** Stable identifier of this connection, unique within its transport. */
    String id();

    /**
     * Sends one text frame. Any exception marks the connection as dead.
     */
    void send(String text) throws Exception;

    boolean isOpen();
}
