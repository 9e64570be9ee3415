package com.opsdash.realtimeservice.dto;

import com.opsdash.realtimeservice.dashboard.DashboardViewKind;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MountDashboardRequest {

    @NotBlank
    private String viewId;

    // defaults to ROLE_DASHBOARD
    private DashboardViewKind kind;
}
