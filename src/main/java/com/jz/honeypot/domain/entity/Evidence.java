package com.jz.honeypot.domain.entity;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 五类只增不减的证据集合。合并用 {@link #mergeFrom(Evidence)}，取独立副本用 {@link #copy()}。
 * <p>
 * 非线程安全：会话里的实例只在会话锁内访问，流水线里的实例只属于单个请求。
 */
public class Evidence {

    private final Set<String> links = new TreeSet<>();
    private final Set<String> paymentHandles = new TreeSet<>();
    private final Set<String> phoneNumbers = new TreeSet<>();
    private final Set<String> accountNumbers = new TreeSet<>();
    private final Set<String> keywords = new TreeSet<>();

    public void addLink(String v)          { add(links, v); }
    public void addPaymentHandle(String v) { add(paymentHandles, v); }
    public void addPhoneNumber(String v)   { add(phoneNumbers, v); }
    public void addAccountNumber(String v) { add(accountNumbers, v); }
    public void addKeyword(String v)       { add(keywords, v); }

    /** 按类别取并集 */
    public void mergeFrom(Evidence other) {
        if (other == null || other == this) return;
        links.addAll(other.links);
        paymentHandles.addAll(other.paymentHandles);
        phoneNumbers.addAll(other.phoneNumbers);
        accountNumbers.addAll(other.accountNumbers);
        keywords.addAll(other.keywords);
    }

    public Evidence copy() {
        Evidence e = new Evidence();
        e.mergeFrom(this);
        return e;
    }

    /** 链接/收款账号/手机号/银行账号中非空的类别数 */
    public int artifactCategoryCount() {
        int n = 0;
        if (!links.isEmpty()) n++;
        if (!paymentHandles.isEmpty()) n++;
        if (!phoneNumbers.isEmpty()) n++;
        if (!accountNumbers.isEmpty()) n++;
        return n;
    }

    public boolean isEmpty() {
        return links.isEmpty() && paymentHandles.isEmpty() && phoneNumbers.isEmpty()
                && accountNumbers.isEmpty() && keywords.isEmpty();
    }

    public Set<String> getLinks()          { return Collections.unmodifiableSet(links); }
    public Set<String> getPaymentHandles() { return Collections.unmodifiableSet(paymentHandles); }
    public Set<String> getPhoneNumbers()   { return Collections.unmodifiableSet(phoneNumbers); }
    public Set<String> getAccountNumbers() { return Collections.unmodifiableSet(accountNumbers); }
    public Set<String> getKeywords()       { return Collections.unmodifiableSet(keywords); }

    /** 排序后的快照，与本实例无关联 */
    public static List<String> sorted(Collection<String> values) {
        return List.copyOf(new TreeSet<>(values));
    }

    private static void add(Set<String> target, String v) {
        if (v != null && !v.isEmpty()) target.add(v);
    }

    @Override
    public String toString() {
        return "Evidence{links=" + links.size() + ", paymentHandles=" + paymentHandles.size()
                + ", phoneNumbers=" + phoneNumbers.size() + ", accountNumbers=" + accountNumbers.size()
                + ", keywords=" + keywords.size() + "}";
    }
}
