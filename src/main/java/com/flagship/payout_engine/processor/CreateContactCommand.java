package com.flagship.payout_engine.processor;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A processor contact: the person a fund account belongs to.
 */
@Value
@Builder
public class CreateContactCommand {
    String name;
    String email;
    String phone;
    String type;
    String referenceId;
    Map<String, String> notes;
}
