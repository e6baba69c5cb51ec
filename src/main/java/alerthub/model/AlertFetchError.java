package alerthub.model;

import lombok.Value;

@Value
public class AlertFetchError {
    String source;
    String message;
}
