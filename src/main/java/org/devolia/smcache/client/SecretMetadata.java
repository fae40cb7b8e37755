package org.devolia.smcache.client;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable result of describing a secret.
 *
 * <p>Only the version to stage mapping is retained; it is all the cache needs to resolve a stage
 * label such as {@code AWSCURRENT} to a concrete version id.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class SecretMetadata {

  private final String name;
  private final Map<String, Set<String>> versionIdsToStages;

  /**
   * Creates secret metadata.
   *
   * @param name the secret name as reported by the backend
   * @param versionIdsToStages version ids mapped to their stage labels, null means no versions
   */
  public SecretMetadata(String name, Map<String, ? extends Collection<String>> versionIdsToStages) {
    this.name = name;
    Map<String, Set<String>> copy = new LinkedHashMap<>();
    if (versionIdsToStages != null) {
      versionIdsToStages.forEach(
          (versionId, stages) ->
              copy.put(
                  versionId,
                  stages == null
                      ? Collections.emptySet()
                      : Collections.unmodifiableSet(new LinkedHashSet<>(stages))));
    }
    this.versionIdsToStages = Collections.unmodifiableMap(copy);
  }

  /**
   * Gets the secret name.
   *
   * @return the name, or null if the backend did not report one
   */
  public String getName() {
    return name;
  }

  /**
   * Gets the version ids mapped to their stage labels.
   *
   * @return unmodifiable mapping, empty if the secret has no versions
   */
  public Map<String, Set<String>> getVersionIdsToStages() {
    return versionIdsToStages;
  }

  /**
   * Finds the version currently carrying the given stage label.
   *
   * @param versionStage the stage label
   * @return the first version id labelled with the stage, or empty if none is
   */
  public Optional<String> findVersionId(String versionStage) {
    return versionIdsToStages.entrySet().stream()
        .filter(entry -> entry.getValue().contains(versionStage))
        .map(Map.Entry::getKey)
        .findFirst();
  }

  @Override
  public String toString() {
    return "SecretMetadata{name=" + name + ", versions=" + versionIdsToStages + "}";
  }
}
