package org.showvault.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SceneExceptionRequest {
    @NotBlank(message = "Scene exception name must not be empty.")
    private String name;
}
