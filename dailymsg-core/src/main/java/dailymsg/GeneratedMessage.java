package dailymsg;

import java.util.Objects;

/**
 * Output of a {@link Generator}: the message text and a stable fingerprint of it.
 */
public record GeneratedMessage(String content, String fingerprint) {

  public GeneratedMessage {
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(fingerprint, "fingerprint");
  }
}
