package com.opsdash.realtimeservice.dto;

import lombok.Value;

@Value
public class BulkUpdateResponse {
    int updated;
}
