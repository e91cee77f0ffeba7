package com.example.research_insights_backend.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.example.research_insights_backend.model.Work;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface WorkMapper extends BaseMapper<Work> {
}
