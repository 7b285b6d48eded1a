package io.runwatch.api.model;

/**
 * Outcome of an admission request: either the id of the admitted run, or the conflict that
 * prevented it.
 */
public final class Admission {
   private final String runId;
   private final AdmissionConflict conflict;

   private Admission(String runId, AdmissionConflict conflict) {
      this.runId = runId;
      this.conflict = conflict;
   }

   public static Admission admitted(String runId) {
      return new Admission(runId, null);
   }

   public static Admission rejected(AdmissionConflict conflict) {
      return new Admission(null, conflict);
   }

   public boolean isAdmitted() {
      return runId != null;
   }

   public String runId() {
      if (runId == null) {
         throw new IllegalStateException("Run was not admitted: " + conflict);
      }
      return runId;
   }

   public AdmissionConflict conflict() {
      return conflict;
   }

   @Override
   public String toString() {
      return isAdmitted() ? "Admitted(" + runId + ")" : "Rejected(" + conflict + ")";
   }
}
