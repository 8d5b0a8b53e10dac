package com.autopost.api.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 统一响应结果封装类。
 * <p>
 * 所有管理接口均以此结构返回，成功响应码为 "0000"。
 * </p>
 *
 * @param <T> 响应数据的类型
 * @author autopost
 * @since 2025-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = 4183310968125067790L;

    /** 响应码 */
    private String code;

    /** 响应描述信息 */
    private String info;

    private T data;

}
