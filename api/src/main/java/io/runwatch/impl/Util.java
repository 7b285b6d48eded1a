package io.runwatch.impl;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public final class Util {
   private Util() {
   }

   public static String explainCauses(Throwable e) {
      StringBuilder causes = new StringBuilder();
      Set<Throwable> reported = new HashSet<>();
      while (e != null && !reported.contains(e)) {
         if (causes.length() != 0) {
            causes.append(": ");
         }
         causes.append(e.getMessage());
         reported.add(e);
         e = e.getCause();
      }
      return causes.toString();
   }

   public static ThreadFactory daemonThreadFactory(String prefix) {
      return new ThreadFactory() {
         private final AtomicInteger counter = new AtomicInteger();

         @Override
         public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
         }
      };
   }

   public static String prettyPrintMillis(long millis) {
      if (millis < 1000) {
         return millis + " ms";
      }
      long seconds = millis / 1000;
      if (seconds < 60) {
         return seconds + " s";
      }
      long minutes = seconds / 60;
      if (minutes < 60) {
         return String.format("%d min %02d s", minutes, seconds % 60);
      }
      return String.format("%d h %02d min", minutes / 60, minutes % 60);
   }

   public static boolean isBlank(String value) {
      return value == null || value.isBlank();
   }
}
