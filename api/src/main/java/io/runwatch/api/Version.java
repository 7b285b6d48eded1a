package io.runwatch.api;

import java.net.URL;
import java.util.jar.Attributes;
import java.util.jar.Manifest;

import org.apache.logging.log4j.LogManager;

public class Version {
   public static final String VERSION;

   static {
      String version = "unknown";
      try {
         String classPath = Version.class.getResource(Version.class.getSimpleName() + ".class").toString();
         if (classPath.startsWith("jar")) {
            String manifestPath = classPath.substring(0, classPath.lastIndexOf("!") + 1) +
                  "/META-INF/MANIFEST.MF";
            Manifest manifest = new Manifest(new URL(manifestPath).openStream());
            Attributes attr = manifest.getMainAttributes();
            String implementationVersion = attr.getValue("Implementation-Version");
            if (implementationVersion != null) {
               version = implementationVersion;
            }
         }
      } catch (Throwable e) {
         LogManager.getLogger(Version.class).error("Cannot find version info.", e);
      } finally {
         VERSION = version;
      }
   }
}
