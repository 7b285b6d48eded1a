package io.runwatch.core.identity;

/**
 * Assigns stable identifiers to tests so that repeated executions of the same test correlate.
 * The id depends only on the normalized file path and the test title; it does not change across
 * restarts and is identical to the id computed by the worker-side reporter.
 */
public final class TestIdentity {
   public static final String PREFIX = "test-";
   private static final String[] TEST_DIR_PREFIXES = { "e2e/tests/", "tests/", "e2e/" };

   private TestIdentity() {
   }

   public static String assign(String filePath, String title) {
      String content = normalizePath(filePath) + ":" + (title == null ? "" : title);
      int hash = 0;
      for (int i = 0; i < content.length(); i++) {
         hash = (hash << 5) - hash + content.charAt(i);
      }
      // widen before abs(): Integer.MIN_VALUE has no positive int counterpart
      return PREFIX + Long.toString(Math.abs((long) hash), 36);
   }

   /**
    * Strips one leading test directory prefix ({@code e2e/tests/}, {@code tests/} or {@code e2e/}),
    * accepting both slash and backslash separators.
    */
   public static String normalizePath(String filePath) {
      if (filePath == null) {
         return "";
      }
      for (String prefix : TEST_DIR_PREFIXES) {
         if (filePath.startsWith(prefix) || filePath.startsWith(prefix.replace('/', '\\'))) {
            return filePath.substring(prefix.length());
         }
      }
      return filePath;
   }
}
