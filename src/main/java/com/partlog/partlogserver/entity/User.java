package com.partlog.partlogserver.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;


@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
public class User extends AbstractNamedDBElement {

    private String fullName;
    private String password; // хэш
    private boolean needPwChange;
    private String googleAuthenticatorSecret;
    private String backupCodes;
    private Integer trustedDeviceCookieVersion = 0;
    private String pwResetToken;
    private LocalDateTime backupCodesGenerationDate;

    @Enumerated(EnumType.STRING)
    private Role role = Role.READ_ONLY;

    @Override
    public EntityKind getKind() {
        return EntityKind.USER;
    }

    @Override
    public Map<String, Object> readFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", getName());
        fields.put("fullName", fullName);
        fields.put("password", password);
        fields.put("needPwChange", needPwChange);
        fields.put("googleAuthenticatorSecret", googleAuthenticatorSecret);
        fields.put("backupCodes", backupCodes);
        fields.put("trustedDeviceCookieVersion", trustedDeviceCookieVersion);
        fields.put("pwResetToken", pwResetToken);
        fields.put("backupCodesGenerationDate", backupCodesGenerationDate);
        fields.put("role", role);
        return fields;
    }
}
