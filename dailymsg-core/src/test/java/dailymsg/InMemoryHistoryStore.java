package dailymsg;

import java.util.ArrayList;
import java.util.List;

public class InMemoryHistoryStore implements HistoryStore {
  private final List<String[]> entries = new ArrayList<>();

  @Override
  public synchronized List<String> recentFingerprints(String subscriberId, int limit) {
    List<String> recent = new ArrayList<>();
    for (int i = entries.size() - 1; i >= 0 && recent.size() < limit; i--) {
      if (entries.get(i)[0].equals(subscriberId)) {
        recent.add(entries.get(i)[1]);
      }
    }
    return recent;
  }

  @Override
  public synchronized void record(String subscriberId, String fingerprint) {
    entries.add(new String[]{subscriberId, fingerprint});
  }

  public synchronized int size() {
    return entries.size();
  }
}
