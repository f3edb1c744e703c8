package com.metascan.explorer.modules.privacy;

import com.metascan.explorer.config.ExplorerProperties;
import com.metascan.explorer.modules.identity.Identity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Redacts DIDs for viewers who are not a participant of the record.
 *
 * <p>The decision is made once per record: either every DID field is shown in clear or every one
 * is masked.</p>
 */
@Component
public class PrivacyMask {

    private final int maskLength;
    private final int displayLength;
    private final char maskChar;

    public PrivacyMask(ExplorerProperties properties) {
        ExplorerProperties.Privacy privacy = properties.getPrivacy();
        this.maskLength = privacy.getMaskLength();
        this.displayLength = privacy.getDisplayLength();
        this.maskChar = privacy.getMaskChar();
    }

    /**
     * Keeps the first {@code maskLength} characters and pads with the mask character to
     * {@code displayLength}. Masking an already masked value returns it unchanged.
     */
    public String mask(String did) {
        if (did == null) {
            return null;
        }
        String head = did.length() > maskLength ? did.substring(0, maskLength) : did;
        StringBuilder masked = new StringBuilder(Math.max(displayLength, head.length())).append(head);
        while (masked.length() < displayLength) {
            masked.append(maskChar);
        }
        return masked.toString();
    }

    /**
     * True when the viewer is one of the record's participants.
     */
    public boolean reveals(Collection<DidField> fields, Identity viewer) {
        if (!viewer.isAuthenticated()) {
            return false;
        }
        String did = viewer.getDid();
        return fields.stream()
                .filter(DidField::isParticipant)
                .map(DidField::getValue)
                .anyMatch(value -> Objects.equals(value, did));
    }

    /**
     * Returns the fields as the viewer may see them, in input order.
     */
    public List<DidField> apply(List<DidField> fields, Identity viewer) {
        if (reveals(fields, viewer)) {
            return List.copyOf(fields);
        }
        List<DidField> masked = new ArrayList<>(fields.size());
        for (DidField field : fields) {
            masked.add(new DidField(field.getRole(), mask(field.getValue()), field.isParticipant()));
        }
        return masked;
    }
}
