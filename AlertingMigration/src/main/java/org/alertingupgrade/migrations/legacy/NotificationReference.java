package org.alertingupgrade.migrations.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A channel reference in alert settings. Older alerts reference channels by id, newer ones by uid. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationReference {
    private String uid;
    private Long id;
}
