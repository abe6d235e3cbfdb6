package world.willfrog.sentinel.triage.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerSummary {

    @NotNull
    @Size(min = 10, max = 500)
    private String customerMessage;

    @NotNull
    @Size(min = 10, max = 1000)
    private String internalNote;

    @NotNull
    @Pattern(regexp = "urgent|standard|reassuring")
    private String tone;
}
