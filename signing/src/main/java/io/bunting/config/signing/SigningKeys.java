package io.bunting.config.signing;

import com.google.common.io.BaseEncoding;
import io.bunting.config.Clock;
import io.bunting.config.Exceptions.SigningException;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Optional;
import java.util.regex.Pattern;

/** RSA key generation and PEM encoding. */
public final class SigningKeys {

  public static final int KEY_SIZE = 2048;

  private static final String PUBLIC_KEY_LABEL = "PUBLIC KEY";
  private static final String PRIVATE_KEY_LABEL = "PRIVATE KEY";
  private static final Pattern KID_PATTERN = Pattern.compile("^[0-9a-f]{32}$");
  private static final Pattern PEM_ARMOR = Pattern.compile("-----(BEGIN|END) [A-Z ]+-----");
  private static final BaseEncoding PEM_BODY = BaseEncoding.base64().withSeparator("\n", 64);
  private static final SecureRandom RANDOM = new SecureRandom();

  private SigningKeys() {}

  /** Generates an inactive key with a random 128-bit key id. */
  public static SigningKey generate(Clock clock) {
    final KeyPair keyPair;
    try {
      final KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
      generator.initialize(KEY_SIZE, RANDOM);
      keyPair = generator.generateKeyPair();
    } catch (GeneralSecurityException e) {
      throw new SigningException("Could not generate an RSA key pair", e);
    }
    return new SigningKey(
        newKid(),
        SigningKey.RS256,
        encodePem(PUBLIC_KEY_LABEL, keyPair.getPublic().getEncoded()),
        Optional.of(encodePem(PRIVATE_KEY_LABEL, keyPair.getPrivate().getEncoded())),
        false,
        clock.get());
  }

  public static String newKid() {
    final byte[] bytes = new byte[16];
    RANDOM.nextBytes(bytes);
    return BaseEncoding.base16().lowerCase().encode(bytes);
  }

  public static boolean isValidKid(String kid) {
    return kid != null && KID_PATTERN.matcher(kid).matches();
  }

  /**
   * @throws SigningException if the PEM is not an X.509 SubjectPublicKeyInfo RSA key
   */
  public static RSAPublicKey parsePublicKey(String pem) {
    try {
      final KeyFactory keyFactory = KeyFactory.getInstance("RSA");
      return (RSAPublicKey) keyFactory.generatePublic(new X509EncodedKeySpec(decodePem(pem)));
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new SigningException("Malformed public key PEM", e);
    }
  }

  /**
   * @throws SigningException if the PEM is not a PKCS#8 RSA key
   */
  public static RSAPrivateKey parsePrivateKey(String pem) {
    try {
      final KeyFactory keyFactory = KeyFactory.getInstance("RSA");
      return (RSAPrivateKey) keyFactory.generatePrivate(new PKCS8EncodedKeySpec(decodePem(pem)));
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new SigningException("Malformed private key PEM", e);
    }
  }

  static String encodePem(String label, byte[] der) {
    return "-----BEGIN "
        + label
        + "-----\n"
        + PEM_BODY.encode(der)
        + "\n-----END "
        + label
        + "-----\n";
  }

  static byte[] decodePem(String pem) {
    if (pem == null) {
      throw new IllegalArgumentException("PEM is null");
    }
    final String body = PEM_ARMOR.matcher(pem).replaceAll("").replaceAll("\\s", "");
    return BaseEncoding.base64().decode(body);
  }
}
