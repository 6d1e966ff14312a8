package com.jguard.filtering.alert;

import com.jguard.platform.RichContent;

import java.util.List;

public record FilterAlert(String title, String content, List<RichContent> embeds) {
}
