package org.waabox.restless;

/**
 * Thrown when a client supplies the {@code id} of a resource to create
 * and the deserializer was built to reject client-generated ids.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ClientGeneratedIdNotAllowedException
    extends DeserializationException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception. */
  public ClientGeneratedIdNotAllowedException() {
    super("Client-generated ID not allowed",
        "Server does not allow client-generated IDs");
  }
}
