package com.jz.honeypot.domain.dto;

import com.jz.honeypot.domain.entity.Evidence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** {@link Evidence} 的对外视图，各列表均已排序 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedIntelligenceDTO {
    private List<String> bankAccounts;
    private List<String> upiIds;
    private List<String> phishingLinks;
    private List<String> phoneNumbers;
    private List<String> suspiciousKeywords;

    public static ExtractedIntelligenceDTO of(Evidence e) {
        return ExtractedIntelligenceDTO.builder()
                .bankAccounts(Evidence.sorted(e.getAccountNumbers()))
                .upiIds(Evidence.sorted(e.getPaymentHandles()))
                .phishingLinks(Evidence.sorted(e.getLinks()))
                .phoneNumbers(Evidence.sorted(e.getPhoneNumbers()))
                .suspiciousKeywords(Evidence.sorted(e.getKeywords()))
                .build();
    }
}
