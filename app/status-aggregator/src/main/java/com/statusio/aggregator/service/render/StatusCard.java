package com.statusio.aggregator.service.render;

/** 利用者へ 1 枚で提示する状態カード。description は改行区切りの複数行テキスト。 */
public record StatusCard(String title, String description) {}
