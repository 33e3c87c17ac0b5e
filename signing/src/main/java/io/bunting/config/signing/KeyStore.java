package io.bunting.config.signing;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Holds each app's signing keys. Implementations must apply {@link #update} atomically: the
 * mutation sees a consistent snapshot and its result replaces the app's keys in one step, or not
 * at all when it throws.
 */
public interface KeyStore {

  List<SigningKey> keys(String appId);

  List<SigningKey> update(String appId, UnaryOperator<List<SigningKey>> mutation);
}
