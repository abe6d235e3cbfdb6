package world.willfrog.sentinel.triage.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComplianceVerdict {

    @JsonProperty("requiresOTP")
    private boolean requiresOtp;
    private String kycLevel;
    @Builder.Default
    private List<PolicyRef> policies = new ArrayList<>();
    private Restrictions restrictions;
    private boolean canFreeze;
    private boolean canDispute;
    @Builder.Default
    private List<String> complianceNotes = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PolicyRef {
        private String code;
        private String title;
        private boolean requiresApproval;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Restrictions {
        private boolean freezeBlocked;
        private boolean disputeBlocked;
        private boolean hasActiveCases;
        private long caseCount;

        public static Restrictions none() {
            return new Restrictions(false, false, false, 0L);
        }
    }
}
