package tech.keyledger.license.key;

/**
 * The two stored hashes of a license key.
 *
 * @param primaryHash HMAC of the key with the hash salt, used for lookup
 * @param verificationHash HMAC of the primary hash with the key secret
 */
public record KeyHashes(String primaryHash, String verificationHash) {
}
