package com.fastalert.model.template;

import lombok.Data;

/**
 * 模板渲染根对象, 每次通知构建一次
 */
@Data
public class ExtendedData {

    private String receiver;
    private String status;
    private ExtendedAlerts alerts;
    private KeyValues groupLabels;
    private KeyValues commonLabels;
    private KeyValues commonAnnotations;
    private String externalURL;
}
