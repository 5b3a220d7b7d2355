package io.intellixity.mapflow.query;

/**
 * Bucket and tag filters of a link phase.\n
 *
 * Both default to the {@link #WILDCARD} which matches any bucket/tag.\n
 */
public record LinkSpec(String bucket, String tag) {
  public static final String WILDCARD = "_";

  public LinkSpec {
    bucket = (bucket == null || bucket.isBlank()) ? WILDCARD : bucket;
    tag = (tag == null || tag.isBlank()) ? WILDCARD : tag;
  }

  public static LinkSpec any() {
    return new LinkSpec(WILDCARD, WILDCARD);
  }
}
