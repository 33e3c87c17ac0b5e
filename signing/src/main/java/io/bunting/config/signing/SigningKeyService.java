package io.bunting.config.signing;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import io.bunting.config.ArtifactCodec;
import io.bunting.config.Clock;
import io.bunting.config.Exceptions.SigningException;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Manages each app's signing keys. At most one key per app is active at any time. */
public class SigningKeyService {

  private static final Logger log = LoggerFactory.getLogger(SigningKeyService.class);

  private static final Comparator<SigningKey> NEWEST_FIRST =
      Comparator.comparing(SigningKey::createdAt).reversed();

  private final KeyStore keyStore;
  private final Clock clock;

  public SigningKeyService(KeyStore keyStore, Clock clock) {
    this.keyStore = requireNonNull(keyStore, "keyStore");
    this.clock = requireNonNull(clock, "clock");
  }

  /** Generates and stores a new key. It is activated only when it is the app's first key. */
  public SigningKey createKey(String appId) {
    final SigningKey generated = SigningKeys.generate(clock);
    final List<SigningKey> updated =
        keyStore.update(
            appId,
            keys -> {
              final SigningKey key = keys.isEmpty() ? generated.withActive(true) : generated;
              return ImmutableList.<SigningKey>builder().addAll(keys).add(key).build();
            });
    final SigningKey stored = find(updated, generated.kid());
    log.info(
        "Created signing key {} for app {} (active: {})", stored.kid(), appId, stored.active());
    return stored;
  }

  /** Stores an existing key, for example a public-only key imported for verification. */
  public void importKey(String appId, SigningKey key) {
    keyStore.update(
        appId,
        keys -> {
          if (keys.stream().anyMatch(existing -> existing.kid().equals(key.kid()))) {
            throw new SigningException(
                String.format("Key %s already exists for app %s", key.kid(), appId));
          }
          if (key.active() && keys.stream().anyMatch(SigningKey::active)) {
            throw new SigningException(
                String.format("App %s already has an active key, rotate instead", appId));
          }
          return ImmutableList.<SigningKey>builder().addAll(keys).add(key).build();
        });
  }

  /**
   * Deactivates every active key and activates {@code newKid}, in one key store update.
   *
   * @throws SigningException if the app has no key {@code newKid}; no key changes then
   */
  public void rotate(String appId, String newKid) {
    keyStore.update(
        appId,
        keys -> {
          if (keys.stream().noneMatch(key -> key.kid().equals(newKid))) {
            throw new SigningException(
                String.format("Key %s not found for app %s", newKid, appId));
          }
          return keys.stream().map(key -> key.withActive(key.kid().equals(newKid))).toList();
        });
    log.info("Rotated signing key for app {} to {}", appId, newKid);
  }

  /**
   * @throws SigningException if the app has no active key or, in violation of the rotation
   *     invariant, more than one
   */
  public SigningKey activeKey(String appId) {
    final List<SigningKey> active =
        keyStore.keys(appId).stream().filter(SigningKey::active).toList();
    if (active.isEmpty()) {
      throw new SigningException("No active signing key found for app " + appId);
    }
    if (active.size() > 1) {
      throw new SigningException(
          String.format("App %s has %d active signing keys", appId, active.size()));
    }
    return active.get(0);
  }

  /** Every key of the app, private halves included, newest first. */
  public List<SigningKey> keys(String appId) {
    return keyStore.keys(appId).stream().sorted(NEWEST_FIRST).toList();
  }

  /** Every key of the app without private material, newest first. */
  public List<SigningKey> verificationKeys(String appId) {
    return keys(appId).stream().map(SigningKey::withoutPrivateKey).toList();
  }

  public List<PublicKeyInfo> exportPublicKeys(String appId) {
    return keys(appId).stream().map(SigningKey::publicInfo).toList();
  }

  /** The export as {@code [{kid, pem, algorithm, isActive}]}. */
  public String exportPublicKeysJson(String appId) {
    final ArrayNode array = ArtifactCodec.nodes().arrayNode();
    for (PublicKeyInfo info : exportPublicKeys(appId)) {
      final ObjectNode node = array.addObject();
      node.put("kid", info.kid());
      node.put("pem", info.pem());
      node.put("algorithm", info.algorithm());
      node.put("isActive", info.isActive());
    }
    return ArtifactCodec.write(array);
  }

  private static SigningKey find(List<SigningKey> keys, String kid) {
    return keys.stream()
        .filter(key -> key.kid().equals(kid))
        .findFirst()
        .orElseThrow(() -> new IllegalStateException("Key " + kid + " vanished from the store"));
  }
}
