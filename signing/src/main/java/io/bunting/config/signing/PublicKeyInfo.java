package io.bunting.config.signing;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import io.bunting.config.ArtifactCodec;
import io.bunting.config.Exceptions.ArtifactParseException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** The public half of a signing key as handed to SDKs. */
public record PublicKeyInfo(String kid, String pem, String algorithm, boolean isActive) {

  /** A verification-only key. Creation time is not part of the export and is left at the epoch. */
  public SigningKey toVerificationKey() {
    return new SigningKey(kid, algorithm, pem, Optional.empty(), isActive, Instant.EPOCH);
  }

  /**
   * Parses the {@code [{kid, pem, algorithm, isActive}]} export.
   *
   * @throws ArtifactParseException if the text is not such an array
   */
  public static List<PublicKeyInfo> listFromJson(String json) {
    final JsonNode root = ArtifactCodec.readTree(json);
    if (!root.isArray()) {
      throw new ArtifactParseException("Public key export must be a JSON array");
    }
    final ImmutableList.Builder<PublicKeyInfo> keys = ImmutableList.builder();
    for (JsonNode node : root) {
      final JsonNode kid = node.get("kid");
      final JsonNode pem = node.get("pem");
      if (kid == null || !kid.isTextual() || pem == null || !pem.isTextual()) {
        throw new ArtifactParseException("Public key entry without kid or pem");
      }
      keys.add(
          new PublicKeyInfo(
              kid.textValue(),
              pem.textValue(),
              node.path("algorithm").asText(SigningKey.RS256),
              node.path("isActive").asBoolean(false)));
    }
    return keys.build();
  }
}
