package com.drautomation.api.model.entity;

import com.drautomation.api.util.StringListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NotificationSettings {

    @Column(name = "notify_on_success")
    private boolean onSuccess;

    @Column(name = "notify_on_failure")
    @Builder.Default
    private boolean onFailure = true;

    @Convert(converter = StringListConverter.class)
    @Column(name = "notification_recipients", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> recipients = new ArrayList<>();
}
