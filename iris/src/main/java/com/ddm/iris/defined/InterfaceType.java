package com.ddm.iris.defined;

/**
 * 交互模态：文本或语音。
 *
 * @author liyifei
 */
public enum InterfaceType {

    TEXT,

    VOICE
}
