package com.example.formstructure.service;

import com.example.formstructure.util.structure.dto.Detection;

import java.io.IOException;

/**
 * OCR 服务（外部协作方）
 *
 * 识别整页图片中某个检测框区域的文本，裁剪由实现方负责。
 */
public interface OcrClient {

    String recognize(byte[] image, Detection detection) throws IOException;
}
