package com.example.formstructure.service;

import com.example.formstructure.util.structure.dto.Detection;

import java.io.IOException;
import java.util.List;

/**
 * 目标检测服务（外部协作方）
 *
 * 输入整页图片，返回带类别和检测框的检测结果（text 为空，由 OCR 填充）。
 */
public interface DetectionClient {

    List<Detection> detect(byte[] image) throws IOException;
}
