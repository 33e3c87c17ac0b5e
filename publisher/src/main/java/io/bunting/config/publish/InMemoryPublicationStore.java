package io.bunting.config.publish;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

public class InMemoryPublicationStore implements PublicationStore {

  private final Map<String, NavigableMap<ConfigVersion, Publication>> publications =
      new ConcurrentHashMap<>();

  @Override
  public Optional<Publication> latest(String appId) {
    final Map.Entry<ConfigVersion, Publication> last = forApp(appId).lastEntry();
    return Optional.ofNullable(last).map(Map.Entry::getValue);
  }

  @Override
  public Optional<Publication> find(String appId, ConfigVersion version) {
    return Optional.ofNullable(forApp(appId).get(version));
  }

  @Override
  public List<Publication> list(String appId) {
    return ImmutableList.copyOf(forApp(appId).descendingMap().values());
  }

  @Override
  public boolean insertIfAbsent(Publication publication) {
    return forApp(publication.appId()).putIfAbsent(publication.version(), publication) == null;
  }

  private NavigableMap<ConfigVersion, Publication> forApp(String appId) {
    return publications.computeIfAbsent(appId, id -> new ConcurrentSkipListMap<>());
  }
}
