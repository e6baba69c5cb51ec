package alerthub.model;

import lombok.Value;

import java.util.List;

@Value
public class AlertSnapshot {
    List<AlertView> alerts;
    List<AlertFetchError> errors;
    HealthOverview health;
}
