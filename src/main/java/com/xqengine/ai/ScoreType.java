package com.xqengine.ai;

/**
 * 分数类型：普通评估分或杀棋步数
 */
public enum ScoreType {
    CP, MATE
}
