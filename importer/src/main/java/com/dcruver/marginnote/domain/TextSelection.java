package com.dcruver.marginnote.domain;

public record TextSelection(int pageNo, Rect rect, String text) {
}
